package ideavalidator.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.Optional;

/**
 * Represents the common configuration of the model used by every specialist.
 */
@ApplicationScoped
public class ModelConfig {
    private static final double DEFAULT_TEMPERATURE = 0.2;
    private static final int DEFAULT_MAX_TOKENS = 1500;
    private static final int DEFAULT_TIMEOUT_SECONDS = 45;

    @Inject
    @ConfigProperty(name = "iv.ollama.model", defaultValue = "llama3.2")
    private String model;

    @Inject
    @ConfigProperty(name = "iv.ollama.contextwindow")
    private Optional<String> contextWindow;

    @Inject
    @ConfigProperty(name = "iv.llm.temperature", defaultValue = "0.2")
    private String temperature;

    @Inject
    @ConfigProperty(name = "iv.llm.maxtokens", defaultValue = "1500")
    private String maxTokens;

    @Inject
    @ConfigProperty(name = "iv.llm.timeoutseconds", defaultValue = "45")
    private String timeoutSeconds;

    public String getModel() {
        return model;
    }

    public Optional<Integer> getContextWindow() {
        return contextWindow
                .filter(NumberUtils::isDigits)
                .map(Integer::parseInt);
    }

    public double getTemperature() {
        return NumberUtils.toDouble(temperature, DEFAULT_TEMPERATURE);
    }

    public int getMaxTokens() {
        return NumberUtils.toInt(maxTokens, DEFAULT_MAX_TOKENS);
    }

    /**
     * The longest a single specialist call may take, before the run deadline is considered.
     */
    public Duration getRequestTimeout() {
        return Duration.ofSeconds(Math.max(1, NumberUtils.toInt(timeoutSeconds, DEFAULT_TIMEOUT_SECONDS)));
    }
}
