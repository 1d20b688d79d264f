package ideavalidator.domain.aggregate;

import ideavalidator.domain.evaluation.EvaluationRecord;
import ideavalidator.domain.evaluation.Proposal;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkNotNull;

@ApplicationScoped
public class DefaultAggregator implements Aggregator {
    public static final double WEAK_AREA_THRESHOLD = 60;
    public static final int MAX_NEXT_STEPS = 5;
    public static final double NEUTRAL_SCORE = 50;

    @Override
    public Aggregation aggregate(final AggregationInput input) {
        checkNotNull(input);

        // Sorting first makes every sum below run in the same order, whatever order the records arrived in
        final List<EvaluationRecord> records = input.records().stream()
                .sorted(Comparator.comparing(EvaluationRecord::specialistId))
                .toList();

        final SortedMap<String, SortedMap<String, SortedMap<String, EvaluationRecord>>> tree = buildTree(records);
        final SortedMap<String, Double> clusterScores = clusterScores(records);
        final double overallScore = overallScore(clusterScores, input.proposal());
        final ValidationOutcome outcome = ValidationOutcome.fromScore(overallScore);
        final double consensus = ConsensusCalculator.consensus(records.stream().map(EvaluationRecord::score).toList());
        final List<WeakArea> weakAreas = weakAreas(records);

        return new Aggregation(
                overallScore,
                outcome,
                clusterScores,
                tree,
                consensus,
                CollaborationInsights.insights(records, clusterScores, consensus),
                weakAreas,
                weakAreas.subList(0, Math.min(MAX_NEXT_STEPS, weakAreas.size())),
                SummaryWriter.overallSummary(input.proposal(), overallScore, outcome, records, clusterScores),
                SummaryWriter.clusterSummaries(records, clusterScores),
                RecommendationRanker.keyRecommendations(records),
                RecommendationRanker.criticalRisks(records),
                RecommendationRanker.marketInsights(records),
                MaturityEstimate.fromScore(overallScore),
                records.size(),
                (int) records.stream().filter(EvaluationRecord::isFallback).count());
    }

    /**
     * When one parameter holds the same sub-parameter twice, the specialist with the smaller id keeps the slot.
     */
    private SortedMap<String, SortedMap<String, SortedMap<String, EvaluationRecord>>> buildTree(
            final List<EvaluationRecord> records) {
        final SortedMap<String, SortedMap<String, SortedMap<String, EvaluationRecord>>> tree = new TreeMap<>();
        for (final EvaluationRecord record : records) {
            tree.computeIfAbsent(record.cluster(), k -> new TreeMap<>())
                    .computeIfAbsent(record.parameter(), k -> new TreeMap<>())
                    .putIfAbsent(record.subParameter(), record);
        }
        return tree;
    }

    private SortedMap<String, Double> clusterScores(final List<EvaluationRecord> records) {
        final SortedMap<String, List<Double>> scores = new TreeMap<>();
        for (final EvaluationRecord record : records) {
            scores.computeIfAbsent(record.cluster(), k -> new ArrayList<>()).add(record.score());
        }

        final SortedMap<String, Double> means = new TreeMap<>();
        scores.forEach((cluster, values) -> means.put(cluster, mean(values)));
        return means;
    }

    /**
     * Custom weights only apply between clusters. Weights for clusters with no records are ignored, and
     * weights that sum to zero fall back to the plain mean.
     */
    double overallScore(final SortedMap<String, Double> clusterScores, final Proposal proposal) {
        if (clusterScores.isEmpty()) {
            return NEUTRAL_SCORE;
        }

        if (proposal.hasCustomWeights()) {
            double weightedSum = 0;
            double weightTotal = 0;
            for (final Map.Entry<String, Double> entry : clusterScores.entrySet()) {
                final double weight = Math.max(0, proposal.weights().getOrDefault(entry.getKey(), 0.0));
                weightedSum += entry.getValue() * weight;
                weightTotal += weight;
            }

            if (weightTotal > 0) {
                return weightedSum / weightTotal;
            }
        }

        return mean(new ArrayList<>(clusterScores.values()));
    }

    private List<WeakArea> weakAreas(final List<EvaluationRecord> records) {
        return records.stream()
                .filter(record -> record.score() < WEAK_AREA_THRESHOLD)
                .sorted(Comparator.comparingDouble(EvaluationRecord::score)
                        .thenComparing(EvaluationRecord::specialistId))
                .map(record -> new WeakArea(
                        record.specialistId(),
                        record.cluster(),
                        record.parameter(),
                        record.subParameter(),
                        record.score(),
                        record.explanation(),
                        record.recommendations()))
                .toList();
    }

    private static double mean(final List<Double> values) {
        if (values.isEmpty()) {
            return NEUTRAL_SCORE;
        }

        double total = 0;
        for (final double value : values) {
            total += value;
        }
        return total / values.size();
    }
}
