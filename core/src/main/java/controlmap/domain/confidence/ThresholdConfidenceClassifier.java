package controlmap.domain.confidence;

import controlmap.domain.config.ConfidenceConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Lower bounds are inclusive: a score equal to the high threshold is HIGH.
 */
@ApplicationScoped
public class ThresholdConfidenceClassifier implements ConfidenceClassifier {
    @Inject
    private ConfidenceConfig confidenceConfig;

    @Override
    public ConfidenceBand classify(final double score) {
        if (score >= confidenceConfig.getHigh()) {
            return ConfidenceBand.HIGH;
        }

        if (score >= confidenceConfig.getMedium()) {
            return ConfidenceBand.MEDIUM;
        }

        return ConfidenceBand.LOW;
    }
}
