package controlmap.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Settings used when mapping policy clauses to controls.
 */
@ApplicationScoped
public class MappingConfig {
    @Inject
    @ConfigProperty(name = "cm.mapping.threshold", defaultValue = "0.5")
    private Double threshold;

    @Inject
    @ConfigProperty(name = "cm.mapping.topk", defaultValue = "50")
    private Integer topK;

    public double getThreshold() {
        return threshold;
    }

    public int getTopK() {
        return Math.max(1, topK);
    }
}
