package controlmap.domain.merge;

public enum MergeOutcome {
    /**
     * At least one candidate cleared the threshold.
     */
    NORMAL_MATCHES,
    /**
     * No candidate cleared the threshold, so the best one is reported with a fallback label.
     */
    FALLBACK_MATCH,
    /**
     * There were no candidates at all.
     */
    NO_MATCH
}
