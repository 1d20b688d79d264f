package ideavalidator.domain.timeout;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

public interface TimeoutService {
    /**
     * Waits for an already running future, returning the result of onTimeout if it does not complete in time.
     */
    <T> T executeWithTimeout(CompletableFuture<T> callback, TimeoutFunctionCallback<T> onTimeout, Duration timeout);
}
