package ideavalidator.domain.exceptions;

/**
 * Represents specialists whose dependencies form a cycle, so no execution order exists.
 */
public class CyclicDependency extends RuntimeException implements InternalException {
    public CyclicDependency() {
        super();
    }

    public CyclicDependency(final String message) {
        super(message);
    }

    public CyclicDependency(final String message, final Throwable cause) {
        super(message, cause);
    }

    public CyclicDependency(final Throwable cause) {
        super(cause);
    }
}
