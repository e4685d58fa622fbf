package controlmap.domain.merge;

import controlmap.domain.confidence.ConfidenceBand;
import controlmap.domain.retrieval.MatchCandidate;

/**
 * A candidate that survived deduplication, with its confidence and explanation.
 *
 * @param candidate       The retrieved candidate
 * @param band            The confidence band of the score
 * @param confidenceLabel The label shown to users, e.g. "High Confidence" or "Very Low (Fallback, Sim=0.31)"
 * @param explanation     Why the match was made
 */
public record MergedMatch(MatchCandidate candidate,
                          ConfidenceBand band,
                          String confidenceLabel,
                          String explanation) {
}
