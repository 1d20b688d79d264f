package ideavalidator.domain.evaluation;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The fields read from a model answer before any defaults or limits are applied.
 */
public record RawEvaluation(@Nullable Double score,
                            @Nullable Double confidence,
                            @Nullable String explanation,
                            List<String> keyInsights,
                            List<String> strengths,
                            List<String> weaknesses,
                            List<String> recommendations,
                            List<String> riskFactors,
                            List<String> assumptions,
                            List<String> marketConsiderations) {
    public RawEvaluation {
        keyInsights = keyInsights == null ? List.of() : List.copyOf(keyInsights);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        marketConsiderations = marketConsiderations == null ? List.of() : List.copyOf(marketConsiderations);
    }

    public static RawEvaluation salvaged(final double score, final double confidence,
                                         final String explanation, final List<String> assumptions) {
        return new RawEvaluation(score, confidence, explanation,
                List.of(), List.of(), List.of(), List.of(), List.of(), assumptions, List.of());
    }
}
