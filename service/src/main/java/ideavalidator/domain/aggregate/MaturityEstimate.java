package ideavalidator.domain.aggregate;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A readiness level from 1 to 9 that rises linearly with the overall score.
 *
 * @param level   The readiness level
 * @param label   The tier of the same score
 * @param outcome The outcome band the label came from
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MaturityEstimate(int level, String label, ValidationOutcome outcome) {
    private static final int MIN_LEVEL = 1;
    private static final int LEVEL_SPAN = 8;

    public static MaturityEstimate fromScore(final double score) {
        final double bounded = Math.max(0, Math.min(100, score));
        final int level = MIN_LEVEL + (int) Math.round(bounded / 100 * LEVEL_SPAN);
        final ValidationOutcome outcome = ValidationOutcome.fromScore(bounded);

        return new MaturityEstimate(level, "Level " + level + " - " + outcome.getLabel(), outcome);
    }
}
