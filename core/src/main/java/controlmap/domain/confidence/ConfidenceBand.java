package controlmap.domain.confidence;

/**
 * How much a similarity score can be trusted.
 */
public enum ConfidenceBand {
    HIGH("High Confidence"),
    MEDIUM("Medium Confidence"),
    LOW("Low Confidence"),
    /**
     * Nothing cleared the threshold and the closest candidate is reported anyway.
     */
    FALLBACK("Very Low");

    private final String label;

    ConfidenceBand(final String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
