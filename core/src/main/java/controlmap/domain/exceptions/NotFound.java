package controlmap.domain.exceptions;

/**
 * Represents a required input file or table that does not exist.
 */
public class NotFound extends RuntimeException implements InternalException {
    public NotFound() {
        super();
    }

    public NotFound(final String message) {
        super(message);
    }

    public NotFound(final String message, final Throwable cause) {
        super(message, cause);
    }

    public NotFound(final Throwable cause) {
        super(cause);
    }
}
