package ideavalidator.domain.timeout;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

@ApplicationScoped
public class CompletableFutureTimeoutService implements TimeoutService {
    @Inject
    private Logger logger;

    @Override
    public <T> T executeWithTimeout(
            final CompletableFuture<T> callback,
            final TimeoutFunctionCallback<T> onTimeout,
            final Duration timeout) {
        checkNotNull(callback, "callback must not be null");
        checkNotNull(onTimeout, "onTimeout must not be null");
        checkNotNull(timeout, "timeout must not be null");

        final long timeoutMillis = Math.max(0, timeout.toMillis());

        return Try.of(() -> await(callback, timeoutMillis))
                .onFailure(TimeoutException.class, e -> logger.warning("Operation timed out after " + timeoutMillis + " milliseconds"))
                .recover(TimeoutException.class, e -> onTimeout.apply())
                .get();
    }

    /**
     * vavr rethrows an InterruptedException rather than capturing it, so an interrupted wait is reported
     * as a timeout, with the interrupt flag restored for the caller to check.
     */
    private <T> T await(final CompletableFuture<T> callback, final long timeoutMillis)
            throws ExecutionException, TimeoutException {
        try {
            return callback.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TimeoutException("Interrupted while waiting for the operation to complete");
        }
    }
}
