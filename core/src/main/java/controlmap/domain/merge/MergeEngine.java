package controlmap.domain.merge;

import controlmap.domain.retrieval.MatchCandidate;

import java.util.List;

/**
 * Turns the raw candidates of one query into the final list of matches.
 */
public interface MergeEngine {
    /**
     * @param candidates The candidates retrieved for a single query
     * @param threshold  The minimum score of a normal match
     * @return The distinct matches that cleared the threshold, a single fallback match if none did, or no
     * match if there were no candidates
     */
    MergeResult merge(List<MatchCandidate> candidates, double threshold);
}
