package controlmap.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Settings of the embedding model.
 */
@ApplicationScoped
public class EmbeddingConfig {
    @Inject
    @ConfigProperty(name = "cm.embedding.model", defaultValue = "sentence-transformers/all-mpnet-base-v2")
    private String model;

    @Inject
    @ConfigProperty(name = "cm.embedding.engine", defaultValue = "PyTorch")
    private String engine;

    /**
     * The number of texts sent to the model in one call when a whole corpus is embedded.
     */
    @Inject
    @ConfigProperty(name = "cm.embedding.batchsize", defaultValue = "64")
    private Integer batchSize;

    public String getModel() {
        return model;
    }

    public String getModelUrl() {
        return "djl://ai.djl.huggingface.pytorch/" + model;
    }

    public String getEngine() {
        return engine;
    }

    public int getBatchSize() {
        return Math.max(1, batchSize);
    }
}
