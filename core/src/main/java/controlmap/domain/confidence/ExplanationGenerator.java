package controlmap.domain.confidence;

import controlmap.domain.retrieval.MatchCandidate;

/**
 * Renders the human readable explanation attached to a match.
 */
public interface ExplanationGenerator {
    String explain(MatchCandidate candidate, ConfidenceBand band);

    /**
     * The label of a fallback match, which includes its score.
     */
    String fallbackLabel(MatchCandidate candidate);

    String explainFallback(MatchCandidate candidate);
}
