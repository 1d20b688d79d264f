package ideavalidator.domain.exceptions;

/**
 * Represents a specialist catalog that can never be satisfied, such as a dependency on an unknown name.
 * This is raised while the registry is built and is fatal at startup.
 */
public class InvalidRegistry extends RuntimeException implements InternalException {
    public InvalidRegistry() {
        super();
    }

    public InvalidRegistry(final String message) {
        super(message);
    }

    public InvalidRegistry(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InvalidRegistry(final Throwable cause) {
        super(cause);
    }
}
