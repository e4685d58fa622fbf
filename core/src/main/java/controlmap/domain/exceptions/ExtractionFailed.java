package controlmap.domain.exceptions;

/**
 * Represents a failure to extract text from a document.
 */
public class ExtractionFailed extends RuntimeException implements ExternalException {
    public ExtractionFailed() {
        super();
    }

    public ExtractionFailed(final String message) {
        super(message);
    }

    public ExtractionFailed(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ExtractionFailed(final Throwable cause) {
        super(cause);
    }
}
