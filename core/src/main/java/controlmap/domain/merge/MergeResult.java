package controlmap.domain.merge;

import controlmap.domain.retrieval.MatchCandidate;

import java.util.List;

/**
 * @param outcome Whether normal matches, a fallback match, or nothing was found
 * @param matches The merged matches ordered by descending score
 */
public record MergeResult(MergeOutcome outcome, List<MergedMatch> matches) {
    public MergeResult {
        matches = List.copyOf(matches);
    }

    public static MergeResult noMatch() {
        return new MergeResult(MergeOutcome.NO_MATCH, List.of());
    }

    public List<MatchCandidate> candidates() {
        return matches.stream().map(MergedMatch::candidate).toList();
    }
}
