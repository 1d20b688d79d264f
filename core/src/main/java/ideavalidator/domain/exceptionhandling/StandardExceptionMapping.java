package ideavalidator.domain.exceptionhandling;

import ideavalidator.domain.exceptions.ExternalException;
import ideavalidator.domain.exceptions.ExternalFailure;
import ideavalidator.domain.exceptions.InternalFailure;
import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * Standard implementation of exception mapping.
 * Maps all exceptions to either InternalFailure or ExternalFailure.
 * InternalFailure indicates a non-recoverable error.
 * ExternalFailure indicates a potentially recoverable error (e.g. by retrying).
 */
@ApplicationScoped
public class StandardExceptionMapping implements ExceptionMapping {
    @Override
    public <T> Try<T> map(final Try<T> tryObject) {
        checkNotNull(tryObject);

        return tryObject.mapFailure(
                // InternalFailure passes through.
                API.Case(API.$(instanceOf(InternalFailure.class)), throwable -> throwable),
                // ExternalFailure passes through.
                API.Case(API.$(instanceOf(ExternalFailure.class)), throwable -> throwable),
                // Only exceptions that explicitly implement ExternalException are treated as external.
                API.Case(API.$(instanceOf(ExternalException.class)), throwable -> new ExternalFailure(throwable)),
                // Map everything else to InternalFailure.
                API.Case(API.$(), throwable -> new InternalFailure(throwable)));
    }
}
