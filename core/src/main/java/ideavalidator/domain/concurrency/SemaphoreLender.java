package ideavalidator.domain.concurrency;

import java.util.concurrent.Semaphore;

/**
 * Represents a shared semaphore that can be lent out to multiple threads using try-with-resources.
 */
public class SemaphoreLender {
    private final Semaphore semaphore;

    public SemaphoreLender(final int permits) {
        semaphore = new Semaphore(permits);
    }

    /**
     * Lend a permit from the semaphore. This blocks until a permit is available.
     */
    public SemaphorePermit lend() throws InterruptedException {
        return new SemaphorePermit(semaphore);
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
