package ideavalidator.domain.evaluation;

import java.util.List;

/**
 * Deterministic list entries used when a model leaves a required list empty.
 */
public final class Placeholders {
    private Placeholders() {
    }

    public static List<String> strengths(final String subParameter) {
        return List.of(
                "Foundational framework for " + subParameter + " established",
                "Initial assessment of " + subParameter + " feasibility completed");
    }

    public static List<String> weaknesses(final String subParameter) {
        return List.of(
                "Limited validation data for " + subParameter,
                "Potential scalability challenges in " + subParameter);
    }

    public static List<String> keyInsights(final String subParameter) {
        return List.of(
                "Requires deeper analysis of " + subParameter,
                "Market context critical for " + subParameter);
    }

    public static List<String> recommendations(final String subParameter) {
        return List.of(
                "Validate " + subParameter + " assumptions through market research",
                "Benchmark " + subParameter + " against top 3 competitors",
                "Develop improvement roadmap for " + subParameter + " based on findings");
    }
}
