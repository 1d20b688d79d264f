package ideavalidator.domain.timeout;

import ideavalidator.domain.logger.Loggers;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(CompletableFutureTimeoutService.class)
@AddBeanClasses(Loggers.class)
class CompletableFutureTimeoutServiceTest {

    @Inject
    private TimeoutService timeoutService;

    @Test
    void testCompletedFutureReturnsValue() {
        final String result = timeoutService.executeWithTimeout(
                CompletableFuture.completedFuture("done"),
                () -> "timed out",
                Duration.ofSeconds(1));

        assertEquals("done", result);
    }

    @Test
    void testSlowFutureReturnsTimeoutValue() {
        final CompletableFuture<String> neverCompletes = new CompletableFuture<>();

        final String result = timeoutService.executeWithTimeout(
                neverCompletes,
                () -> "timed out",
                Duration.ofMillis(50));

        assertEquals("timed out", result);
    }

    @Test
    void testNegativeTimeoutChecksImmediately() {
        final String result = timeoutService.executeWithTimeout(
                new CompletableFuture<>(),
                () -> "timed out",
                Duration.ofSeconds(-5));

        assertEquals("timed out", result);
    }

    @Test
    void testInterruptedWaitReturnsTimeoutValue() {
        Thread.currentThread().interrupt();

        final String result = timeoutService.executeWithTimeout(
                new CompletableFuture<>(),
                () -> "timed out",
                Duration.ofSeconds(5));

        assertEquals("timed out", result);
        // Clearing the flag here also keeps it from leaking into other tests
        assertTrue(Thread.interrupted());
    }
}
