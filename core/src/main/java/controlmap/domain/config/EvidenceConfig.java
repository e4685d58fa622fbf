package controlmap.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Settings used when validating evidence against the requirements of a control.
 */
@ApplicationScoped
public class EvidenceConfig {
    /**
     * Evidence is valid when its best requirement match scores at least this much.
     */
    @Inject
    @ConfigProperty(name = "cm.evidence.threshold", defaultValue = "0.6")
    private Double threshold;

    @Inject
    @ConfigProperty(name = "cm.evidence.maxmatches", defaultValue = "10")
    private Integer maxMatches;

    public double getThreshold() {
        return threshold;
    }

    public int getMaxMatches() {
        return Math.max(1, maxMatches);
    }
}
