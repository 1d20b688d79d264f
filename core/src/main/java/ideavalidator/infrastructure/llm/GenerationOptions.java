package ideavalidator.infrastructure.llm;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Per-call generation settings.
 *
 * @param model       The model to use, or null for the configured default
 * @param maxTokens   The maximum number of tokens to generate
 * @param temperature The sampling temperature
 * @param timeout     How long the call may take before it is abandoned
 */
public record GenerationOptions(@Nullable String model, int maxTokens, double temperature, Duration timeout) {
}
