package ideavalidator.domain.orchestrator;

import ideavalidator.domain.specialist.FrameworkInfo;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Map;

/**
 * The entry point for validating an idea.
 */
public interface ValidationOrchestrator {
    /**
     * Runs every specialist against an idea and aggregates their judgements. This never throws: a run that
     * cannot complete returns a fallback result with an error message.
     *
     * @param name     The idea name
     * @param concept  The idea description
     * @param weights  Optional relative weights keyed by cluster name
     * @param deadline How long the whole run may take, or null for the configured default
     * @return The result of the run
     */
    ValidationResult validateIdea(@Nullable String name,
                                  @Nullable String concept,
                                  @Nullable Map<String, Double> weights,
                                  @Nullable Duration deadline);

    FrameworkInfo frameworkInfo();
}
