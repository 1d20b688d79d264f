package ideavalidator.domain.aggregate;

import ideavalidator.domain.evaluation.EvaluationRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;

/**
 * Short statements about where specialists agreed and disagreed.
 */
public final class CollaborationInsights {
    public static final double HIGH_BAND = 70;
    public static final double LOW_BAND = 40;
    private static final double HIGH_CONSENSUS = 0.8;
    private static final double MODERATE_CONSENSUS = 0.5;

    private CollaborationInsights() {
    }

    public static List<String> insights(final List<EvaluationRecord> records,
                                        final SortedMap<String, Double> clusterScores,
                                        final double consensus) {
        final List<String> insights = new ArrayList<>();
        if (records.isEmpty()) {
            return insights;
        }

        final long high = records.stream().filter(r -> r.score() >= HIGH_BAND).count();
        final long low = records.stream().filter(r -> r.score() < LOW_BAND).count();
        final long medium = records.size() - high - low;

        insights.add("Score distribution: " + high + " high (70+), " + medium + " medium (40-69), " + low + " low (below 40)");

        if (medium > high && medium > low) {
            insights.add("Mixed signals: most specialists placed this idea in the medium band");
        }

        if (consensus >= HIGH_CONSENSUS) {
            insights.add("High consensus among specialists (" + format(consensus) + ")");
        } else if (consensus >= MODERATE_CONSENSUS) {
            insights.add("Moderate consensus among specialists (" + format(consensus) + ")");
        } else {
            insights.add("Low consensus: specialists disagree significantly (" + format(consensus) + ")");
        }

        final long dependent = records.stream().filter(r -> !r.dependencies().isEmpty()).count();
        insights.add("Multi-agent collaboration involved " + dependent + " dependent evaluations");

        final long fallbacks = records.stream().filter(EvaluationRecord::isFallback).count();
        if (fallbacks > 0) {
            insights.add(fallbacks + " specialist evaluations used fallback results");
        }

        // Ties keep the alphabetically first cluster
        clusterScores.entrySet().stream()
                .max(Comparator.comparingDouble(Map.Entry<String, Double>::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .ifPresent(best -> insights.add("Strongest area: " + best.getKey() + " (Score: " + format(best.getValue()) + ")"));

        clusterScores.entrySet().stream()
                .min(Comparator.comparingDouble(Map.Entry<String, Double>::getValue)
                        .thenComparing(Map.Entry::getKey))
                .ifPresent(worst -> insights.add("Area for improvement: " + worst.getKey() + " (Score: " + format(worst.getValue()) + ")"));

        return insights;
    }

    static String format(final double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
