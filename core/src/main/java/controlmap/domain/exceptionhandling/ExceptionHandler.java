package controlmap.domain.exceptionhandling;

/**
 * Renders exceptions into messages that can be logged or returned to a caller.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
