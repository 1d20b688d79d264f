package ideavalidator.domain.aggregate;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The banded classification of a score. Every human readable tier in a result is derived from here.
 */
public enum ValidationOutcome {
    EXCELLENT("Excellent", 80),
    GOOD("Good", 60),
    MODERATE("Moderate", 40),
    WEAK("Weak", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double minimumScore;

    ValidationOutcome(final String label, final double minimumScore) {
        this.label = label;
        this.minimumScore = minimumScore;
    }

    public static ValidationOutcome fromScore(final double score) {
        for (final ValidationOutcome outcome : values()) {
            if (score >= outcome.minimumScore) {
                return outcome;
            }
        }

        return WEAK;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
