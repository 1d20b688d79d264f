package ideavalidator.domain.exceptionhandling;

/**
 * Converts an exception into a message that can be logged or returned to a caller.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
