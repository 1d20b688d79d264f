package ideavalidator.domain.aggregate;

import ideavalidator.domain.evaluation.EvaluationRecord;
import ideavalidator.domain.evaluation.Proposal;
import org.apache.commons.lang3.StringUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Writes the narrative parts of a result.
 */
public final class SummaryWriter {
    private static final int CONCEPT_EXCERPT_LENGTH = 200;
    private static final double STRENGTH_SCORE = 80;
    private static final double CHALLENGE_SCORE = 50;
    private static final int HIGHLIGHTS = 3;
    private static final int CLUSTER_HIGHLIGHTS = 2;

    private static final Comparator<EvaluationRecord> HIGHEST_FIRST =
            Comparator.comparingDouble(EvaluationRecord::score).reversed()
                    .thenComparing(EvaluationRecord::specialistId);

    private static final Comparator<EvaluationRecord> LOWEST_FIRST =
            Comparator.comparingDouble(EvaluationRecord::score)
                    .thenComparing(EvaluationRecord::specialistId);

    private SummaryWriter() {
    }

    public static String overallSummary(final Proposal proposal,
                                        final double overallScore,
                                        final ValidationOutcome outcome,
                                        final List<EvaluationRecord> records,
                                        final SortedMap<String, Double> clusterScores) {
        // Fallback records say nothing about the idea itself
        final List<String> strengths = records.stream()
                .filter(r -> !r.isFallback() && r.score() >= STRENGTH_SCORE)
                .sorted(HIGHEST_FIRST)
                .limit(HIGHLIGHTS)
                .map(SummaryWriter::highlight)
                .toList();

        final List<String> challenges = records.stream()
                .filter(r -> !r.isFallback() && r.score() <= CHALLENGE_SCORE)
                .sorted(LOWEST_FIRST)
                .limit(HIGHLIGHTS)
                .map(SummaryWriter::highlight)
                .toList();

        final String clusters = clusterScores.entrySet().stream()
                .map(entry -> "- " + entry.getKey() + ": " + format(entry.getValue()) + "/100 - "
                        + ValidationOutcome.fromScore(entry.getValue()).getLabel())
                .collect(Collectors.joining("\n"));

        return "The '" + proposal.name() + "' concept was evaluated by " + records.size()
                + " specialists and achieved an overall score of " + format(overallScore) + "/100 ("
                + outcome.getLabel() + ").\n\n"
                + "CONCEPT OVERVIEW:\n"
                + StringUtils.abbreviate(proposal.concept().trim(), CONCEPT_EXCERPT_LENGTH + 3) + "\n\n"
                + "KEY STRENGTHS IDENTIFIED:\n"
                + (strengths.isEmpty() ? "- Limited standout strengths identified across evaluation parameters" : bullets(strengths)) + "\n\n"
                + "CRITICAL CHALLENGES:\n"
                + (challenges.isEmpty() ? "- No major fundamental issues identified" : bullets(challenges)) + "\n\n"
                + "CLUSTER PERFORMANCE ANALYSIS:\n"
                + clusters + "\n\n"
                + "FINAL ASSESSMENT:\n"
                + "This concept " + finalAssessment(outcome) + ".";
    }

    public static SortedMap<String, ClusterSummary> clusterSummaries(final List<EvaluationRecord> records,
                                                                     final SortedMap<String, Double> clusterScores) {
        final Map<String, List<EvaluationRecord>> byCluster = records.stream()
                .collect(Collectors.groupingBy(EvaluationRecord::cluster));

        final SortedMap<String, ClusterSummary> summaries = new TreeMap<>();
        clusterScores.forEach((cluster, score) -> {
            final List<EvaluationRecord> ranked = byCluster.getOrDefault(cluster, List.of()).stream()
                    .sorted(HIGHEST_FIRST)
                    .toList();

            final List<String> strong = ranked.stream()
                    .limit(CLUSTER_HIGHLIGHTS)
                    .map(SummaryWriter::highlight)
                    .toList();

            final List<String> weak = ranked.stream()
                    .sorted(LOWEST_FIRST)
                    .limit(CLUSTER_HIGHLIGHTS)
                    .map(SummaryWriter::highlight)
                    .toList();

            final ValidationOutcome status = ValidationOutcome.fromScore(score);
            summaries.put(cluster, new ClusterSummary(cluster, score, status, strong, weak, clusterAssessment(status)));
        });

        return summaries;
    }

    private static String highlight(final EvaluationRecord record) {
        final String sentence = StringUtils.substringBefore(record.explanation(), ".").trim();
        return record.subParameter() + " (" + String.format(Locale.ROOT, "%.1f", record.score()) + "/100): "
                + (sentence.isEmpty() ? "No explanation given" : sentence);
    }

    private static String bullets(final List<String> lines) {
        return lines.stream().map(line -> "- " + line).collect(Collectors.joining("\n"));
    }

    private static String finalAssessment(final ValidationOutcome outcome) {
        return switch (outcome) {
            case EXCELLENT -> "demonstrates strong potential for success with proper execution";
            case GOOD -> "shows promise but requires improvements in key areas";
            case MODERATE -> "shows some promise but requires significant improvements in key areas";
            case WEAK -> "faces substantial challenges that must be addressed before proceeding";
        };
    }

    private static String clusterAssessment(final ValidationOutcome status) {
        return switch (status) {
            case EXCELLENT -> "This cluster shows exceptional strength and should be leveraged as a key competitive advantage.";
            case GOOD -> "This cluster demonstrates solid performance with opportunities for optimization.";
            case MODERATE, WEAK -> "This cluster requires focused attention and strategic improvements to reach market viability.";
        };
    }

    private static String format(final double value) {
        return CollaborationInsights.format(value);
    }
}
