package ideavalidator.domain.evaluation;

import ideavalidator.domain.specialist.Specialist;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Turns a tagged response into a canonical record, applying defaults, limits and placeholders.
 */
@ApplicationScoped
public class EvaluationRepair {
    public static final double DEFAULT_SCORE = 60;
    public static final double DEFAULT_CONFIDENCE = 0.7;
    public static final double FALLBACK_SCORE = 50;
    public static final double FALLBACK_CONFIDENCE = 0.5;
    public static final String DEFAULT_EXPLANATION = "Analysis completed";

    private static final double FIVE_POINT_SCALE_MAX = 5;
    private static final int FIVE_POINT_SCALE_FACTOR = 20;
    private static final int MAX_EXPLANATION_WORDS = 50;

    public EvaluationRecord toRecord(final Specialist specialist, final SpecialistResponse response, final Instant started) {
        checkNotNull(specialist);
        checkNotNull(response);

        return switch (response.kind()) {
            case PARSED, REPAIRED -> fromEvaluation(specialist, response.kind(),
                    Objects.requireNonNull(response.evaluation()), started);
            case FALLBACK -> fallback(specialist,
                    StringUtils.defaultIfBlank(response.failureReason(), "Unknown failure"), started);
        };
    }

    /**
     * A neutral record for a specialist whose call failed or never happened.
     */
    public EvaluationRecord fallback(final Specialist specialist, final String reason, final Instant started) {
        checkNotNull(specialist);

        final String subParameter = specialist.subParameter();
        final Instant now = Instant.now();

        return new EvaluationRecord(
                specialist.id(),
                specialist.cluster(),
                specialist.parameter(),
                subParameter,
                specialist.weight(),
                specialist.dependencies(),
                FALLBACK_SCORE,
                FALLBACK_CONFIDENCE,
                "Fallback evaluation for " + subParameter + " due to processing error",
                Placeholders.strengths(subParameter),
                Placeholders.weaknesses(subParameter),
                Placeholders.keyInsights(subParameter),
                Placeholders.recommendations(subParameter),
                List.of("Evaluation uncertainty for " + subParameter),
                List.of("Fallback evaluation applied"),
                List.of(),
                ResponseKind.FALLBACK,
                reason,
                now,
                elapsed(started, now));
    }

    /**
     * Scores at or below 5 are assumed to use a five point scale.
     */
    public static double normalizeScore(@Nullable final Double score) {
        if (score == null || score.isNaN()) {
            return DEFAULT_SCORE;
        }

        final double scaled = score <= FIVE_POINT_SCALE_MAX ? score * FIVE_POINT_SCALE_FACTOR : score;
        return Math.max(0, Math.min(100, scaled));
    }

    public static double normalizeConfidence(@Nullable final Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return DEFAULT_CONFIDENCE;
        }

        return Math.max(0, Math.min(1, confidence));
    }

    public static String normalizeExplanation(@Nullable final String explanation) {
        if (StringUtils.isBlank(explanation)) {
            return DEFAULT_EXPLANATION;
        }

        final String[] words = StringUtils.split(explanation.trim());
        if (words.length <= MAX_EXPLANATION_WORDS) {
            return explanation.trim();
        }

        return String.join(" ", Arrays.copyOf(words, MAX_EXPLANATION_WORDS)) + "...";
    }

    private EvaluationRecord fromEvaluation(final Specialist specialist,
                                            final ResponseKind kind,
                                            final RawEvaluation evaluation,
                                            final Instant started) {
        final String subParameter = specialist.subParameter();
        final Instant now = Instant.now();

        return new EvaluationRecord(
                specialist.id(),
                specialist.cluster(),
                specialist.parameter(),
                subParameter,
                specialist.weight(),
                specialist.dependencies(),
                normalizeScore(evaluation.score()),
                normalizeConfidence(evaluation.confidence()),
                normalizeExplanation(evaluation.explanation()),
                orElse(evaluation.strengths(), Placeholders.strengths(subParameter)),
                orElse(evaluation.weaknesses(), Placeholders.weaknesses(subParameter)),
                orElse(evaluation.keyInsights(), Placeholders.keyInsights(subParameter)),
                orElse(evaluation.recommendations(), Placeholders.recommendations(subParameter)),
                clean(evaluation.riskFactors()),
                clean(evaluation.assumptions()),
                clean(evaluation.marketConsiderations()),
                kind,
                null,
                now,
                elapsed(started, now));
    }

    private static List<String> orElse(final List<String> values, final List<String> placeholders) {
        final List<String> cleaned = clean(values);
        return cleaned.isEmpty() ? placeholders : cleaned;
    }

    private static List<String> clean(final List<String> values) {
        return values.stream()
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .toList();
    }

    private static long elapsed(@Nullable final Instant started, final Instant now) {
        return started == null ? 0 : Math.max(0, Duration.between(started, now).toMillis());
    }
}
