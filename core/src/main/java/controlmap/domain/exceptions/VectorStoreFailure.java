package controlmap.domain.exceptions;

/**
 * Represents a failure reading or writing a vector store file.
 */
public class VectorStoreFailure extends RuntimeException implements InternalException {
    public VectorStoreFailure() {
        super();
    }

    public VectorStoreFailure(final String message) {
        super(message);
    }

    public VectorStoreFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public VectorStoreFailure(final Throwable cause) {
        super(cause);
    }
}
