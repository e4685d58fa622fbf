package controlmap.domain.embedding;

import ai.djl.huggingface.translator.TextEmbeddingTranslatorFactory;
import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.training.util.ProgressBar;
import controlmap.domain.config.EmbeddingConfig;
import controlmap.domain.exceptions.EmbeddingGenerationFailed;
import controlmap.domain.vector.Vector;
import io.vavr.control.Try;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.logging.Logger;

/**
 * Use the Java Deep Learning library to embed text with a HuggingFace sentence transformer.
 * The model is loaded on first use, as downloading and loading it takes a while.
 */
@ApplicationScoped
public class DjlEmbeddingModel implements EmbeddingModel {
    @Inject
    private EmbeddingConfig embeddingConfig;

    @Inject
    private Logger logger;

    @Nullable
    private ZooModel<String, float[]> model;

    @Nullable
    private Predictor<String, float[]> predictor;

    @Override
    public List<Vector> embed(final List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        final Predictor<String, float[]> loaded = getPredictor();

        final List<float[]> embeddings = Try.of(() -> loaded.batchPredict(texts))
                .getOrElseThrow(ex -> new EmbeddingGenerationFailed("Error while getting embeddings", ex));

        if (embeddings.size() != texts.size()) {
            throw new EmbeddingGenerationFailed("Model returned " + embeddings.size() + " embeddings for " + texts.size() + " texts");
        }

        return embeddings.stream()
                .map(Vector::new)
                .map(Vector::normalize)
                .toList();
    }

    private synchronized Predictor<String, float[]> getPredictor() {
        if (predictor == null) {
            logger.info("Loading embedding model " + embeddingConfig.getModel());

            model = Try.of(() -> Criteria.builder()
                            .setTypes(String.class, float[].class)
                            .optModelUrls(embeddingConfig.getModelUrl())
                            .optEngine(embeddingConfig.getEngine())
                            .optTranslatorFactory(new TextEmbeddingTranslatorFactory())
                            .optProgress(new ProgressBar())
                            .build())
                    .mapTry(Criteria::loadModel)
                    .onFailure(ex -> logger.severe("Failed to load embedding model: " + ExceptionUtils.getRootCauseMessage(ex)))
                    .getOrElseThrow(ex -> new EmbeddingGenerationFailed("Failed to load embedding model " + embeddingConfig.getModel(), ex));

            predictor = model.newPredictor();
        }

        return predictor;
    }

    @PreDestroy
    private void close() {
        if (predictor != null) {
            predictor.close();
        }
        if (model != null) {
            model.close();
        }
    }
}
