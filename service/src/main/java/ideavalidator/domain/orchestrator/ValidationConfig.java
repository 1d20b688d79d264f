package ideavalidator.domain.orchestrator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * Settings that apply to a whole validation run.
 */
@ApplicationScoped
public class ValidationConfig {
    private static final int DEFAULT_POOL_SIZE = 10;
    private static final int DEFAULT_DEADLINE_SECONDS = 1200;

    @Inject
    @ConfigProperty(name = "iv.validation.poolsize", defaultValue = "10")
    private String poolSize;

    @Inject
    @ConfigProperty(name = "iv.validation.deadlineseconds", defaultValue = "1200")
    private String deadlineSeconds;

    public int getPoolSize() {
        return Math.max(1, NumberUtils.toInt(poolSize, DEFAULT_POOL_SIZE));
    }

    public Duration getDefaultDeadline() {
        return Duration.ofSeconds(Math.max(1, NumberUtils.toInt(deadlineSeconds, DEFAULT_DEADLINE_SECONDS)));
    }
}
