package controlmap.domain.exceptions;

/**
 * Represents a loaded table that is missing an expected column.
 */
public class SchemaError extends RuntimeException implements InternalException {
    public SchemaError() {
        super();
    }

    public SchemaError(final String message) {
        super(message);
    }

    public SchemaError(final String message, final Throwable cause) {
        super(message, cause);
    }

    public SchemaError(final Throwable cause) {
        super(cause);
    }
}
