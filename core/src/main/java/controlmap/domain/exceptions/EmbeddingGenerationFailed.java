package controlmap.domain.exceptions;

/**
 * Represents a failure of the embedding model to vectorize a batch of text.
 */
public class EmbeddingGenerationFailed extends RuntimeException implements ExternalException {
    public EmbeddingGenerationFailed() {
        super();
    }

    public EmbeddingGenerationFailed(final String message) {
        super(message);
    }

    public EmbeddingGenerationFailed(final String message, final Throwable cause) {
        super(message, cause);
    }

    public EmbeddingGenerationFailed(final Throwable cause) {
        super(cause);
    }
}
