package controlmap.domain.exceptions;

/**
 * Represents a vector store whose row count does not match the row count of its record table.
 * This is recoverable by regenerating the vectors.
 */
public class AlignmentMismatch extends RuntimeException implements InternalException {
    public AlignmentMismatch() {
        super();
    }

    public AlignmentMismatch(final String message) {
        super(message);
    }

    public AlignmentMismatch(final String message, final Throwable cause) {
        super(message, cause);
    }

    public AlignmentMismatch(final Throwable cause) {
        super(cause);
    }
}
