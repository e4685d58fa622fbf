package controlmap.domain.exceptions;

/**
 * Represents a failure from an external source.
 * It means if you make the same call with the same data you might be successful.
 * We have a concrete class representing an external failure (in addition to the ExternalException interface)
 * to allow it to be used in methods like Try.recover() in Vavr which require a concrete class.
 */
public class ExternalFailure extends RuntimeException implements ExternalException {
    public ExternalFailure() {
        super();
    }

    public ExternalFailure(final String message) {
        super(message);
    }

    public ExternalFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ExternalFailure(final Throwable cause) {
        super(cause);
    }
}
