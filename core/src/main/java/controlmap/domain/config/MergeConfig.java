package controlmap.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class MergeConfig {
    /**
     * Matches whose text is at least this similar to an already merged match are dropped.
     */
    @Inject
    @ConfigProperty(name = "cm.merge.dedupthreshold", defaultValue = "0.6")
    private Double dedupThreshold;

    public double getDedupThreshold() {
        return dedupThreshold;
    }
}
