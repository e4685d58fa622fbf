package controlmap.domain.embedding;

import controlmap.domain.vector.Vector;

import java.util.List;

/**
 * Turns text into embedding vectors.
 */
public interface EmbeddingModel {
    /**
     * @param texts The texts to embed
     * @return One unit length vector per text, in the same order
     * @throws controlmap.domain.exceptions.EmbeddingGenerationFailed if the model fails
     */
    List<Vector> embed(List<String> texts);

    default Vector embed(final String text) {
        return embed(List.of(text)).get(0);
    }
}
