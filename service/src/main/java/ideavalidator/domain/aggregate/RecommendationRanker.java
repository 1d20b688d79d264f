package ideavalidator.domain.aggregate;

import ideavalidator.domain.evaluation.EvaluationRecord;
import org.apache.commons.lang3.StringUtils;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Merges the free text advice of every specialist into short, ranked lists.
 */
public final class RecommendationRanker {
    public static final int MAX_ENTRIES = 10;
    public static final int MAX_MARKET_INSIGHTS = 8;

    private RecommendationRanker() {
    }

    /**
     * Recommendations given often, and by specialists that scored low, rank first.
     */
    public static List<String> keyRecommendations(final List<EvaluationRecord> records) {
        final Map<String, Tally> tallies = tally(records, EvaluationRecord::recommendations);

        return tallies.values().stream()
                .sorted(Comparator.comparingDouble((Tally t) -> t.count * (100 - t.meanScore())).reversed()
                        .thenComparingInt(t -> t.order))
                .limit(MAX_ENTRIES)
                .map(t -> t.text)
                .toList();
    }

    /**
     * Risks raised most often rank first, then those raised by the lowest scoring specialist.
     */
    public static List<String> criticalRisks(final List<EvaluationRecord> records) {
        final Map<String, Tally> tallies = tally(records, EvaluationRecord::riskFactors);

        return tallies.values().stream()
                .sorted(Comparator.comparingInt((Tally t) -> t.count).reversed()
                        .thenComparingDouble(t -> t.minScore)
                        .thenComparingInt(t -> t.order))
                .limit(MAX_ENTRIES)
                .map(t -> t.text)
                .toList();
    }

    /**
     * Market observations shared by the most specialists rank first.
     */
    public static List<String> marketInsights(final List<EvaluationRecord> records) {
        final Map<String, Tally> tallies = tally(records, EvaluationRecord::marketConsiderations);

        return tallies.values().stream()
                .sorted(Comparator.comparingInt((Tally t) -> t.count).reversed()
                        .thenComparingInt(t -> t.order))
                .limit(MAX_MARKET_INSIGHTS)
                .map(t -> t.text)
                .toList();
    }

    private static Map<String, Tally> tally(final List<EvaluationRecord> records,
                                            final Function<EvaluationRecord, List<String>> field) {
        final Map<String, Tally> tallies = new LinkedHashMap<>();
        for (final EvaluationRecord record : records) {
            final Set<String> seen = new LinkedHashSet<>();
            for (final String entry : field.apply(record)) {
                final String text = StringUtils.trimToEmpty(entry);
                final String key = text.toLowerCase(Locale.ROOT);
                if (text.isEmpty() || !seen.add(key)) {
                    continue;
                }

                tallies.computeIfAbsent(key, k -> new Tally(text, tallies.size())).add(record.score());
            }
        }
        return tallies;
    }

    private static final class Tally {
        private final String text;
        private final int order;
        private int count;
        private double totalScore;
        private double minScore = Double.MAX_VALUE;

        private Tally(final String text, final int order) {
            this.text = text;
            this.order = order;
        }

        private void add(final double score) {
            ++count;
            totalScore += score;
            minScore = Math.min(minScore, score);
        }

        private double meanScore() {
            return count == 0 ? 0 : totalScore / count;
        }
    }
}
