package controlmap.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * The similarity scores at which a match moves into a higher confidence band.
 */
@ApplicationScoped
public class ConfidenceConfig {
    @Inject
    @ConfigProperty(name = "cm.confidence.high", defaultValue = "0.65")
    private Double high;

    @Inject
    @ConfigProperty(name = "cm.confidence.medium", defaultValue = "0.55")
    private Double medium;

    public double getHigh() {
        return high;
    }

    public double getMedium() {
        return medium;
    }
}
