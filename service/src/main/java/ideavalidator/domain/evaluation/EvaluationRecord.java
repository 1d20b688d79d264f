package ideavalidator.domain.evaluation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The repaired, canonical judgement of one specialist in one run. Strengths, weaknesses, key insights
 * and recommendations are never empty.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvaluationRecord(String specialistId,
                               String cluster,
                               String parameter,
                               String subParameter,
                               int weight,
                               List<String> dependencies,
                               double score,
                               double confidence,
                               String explanation,
                               List<String> strengths,
                               List<String> weaknesses,
                               List<String> keyInsights,
                               List<String> recommendations,
                               List<String> riskFactors,
                               List<String> assumptions,
                               List<String> marketConsiderations,
                               ResponseKind kind,
                               @Nullable String failureReason,
                               Instant timestamp,
                               long processingTimeMs) {
    public EvaluationRecord {
        checkNotNull(specialistId);
        checkNotNull(kind);
        checkArgument(score >= 0 && score <= 100, "score must be between 0 and 100");
        checkArgument(confidence >= 0 && confidence <= 1, "confidence must be between 0 and 1");
        checkArgument(strengths != null && !strengths.isEmpty(), "strengths must not be empty");
        checkArgument(weaknesses != null && !weaknesses.isEmpty(), "weaknesses must not be empty");
        checkArgument(keyInsights != null && !keyInsights.isEmpty(), "key insights must not be empty");
        checkArgument(recommendations != null && !recommendations.isEmpty(), "recommendations must not be empty");

        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        strengths = List.copyOf(strengths);
        weaknesses = List.copyOf(weaknesses);
        keyInsights = List.copyOf(keyInsights);
        recommendations = List.copyOf(recommendations);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        marketConsiderations = marketConsiderations == null ? List.of() : List.copyOf(marketConsiderations);
    }

    public boolean isFallback() {
        return kind == ResponseKind.FALLBACK;
    }
}
