package ideavalidator.domain.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import ideavalidator.domain.aggregate.Aggregation;
import ideavalidator.domain.aggregate.ClusterSummary;
import ideavalidator.domain.aggregate.MaturityEstimate;
import ideavalidator.domain.aggregate.SortedMaps;
import ideavalidator.domain.aggregate.ValidationOutcome;
import ideavalidator.domain.aggregate.WeakArea;
import ideavalidator.domain.evaluation.EvaluationRecord;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The outcome of one validation run. A result is always returned and never changes once built. A run
 * that could not complete carries an error message with neutral scores and empty collections.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationResult(String runId,
                               Instant timestamp,
                               String ideaName,
                               String ideaConcept,
                               double overallScore,
                               ValidationOutcome validationOutcome,
                               SortedMap<String, Double> clusterScores,
                               @JsonProperty("detailed_evaluations")
                               SortedMap<String, SortedMap<String, SortedMap<String, EvaluationRecord>>> evaluationTree,
                               double consensusLevel,
                               List<String> collaborationInsights,
                               int totalSpecialistsConsulted,
                               long processingTimeMs,
                               List<WeakArea> weakAreas,
                               List<WeakArea> nextSteps,
                               String overallSummary,
                               SortedMap<String, ClusterSummary> clusterSummaries,
                               List<String> keyRecommendations,
                               List<String> criticalRisks,
                               List<String> marketInsights,
                               MaturityEstimate maturityEstimate,
                               int fallbackCount,
                               @Nullable String errorMessage) {
    public static final double FALLBACK_SCORE = 50;

    public ValidationResult {
        clusterScores = SortedMaps.copyOf(clusterScores);
        evaluationTree = SortedMaps.copyOfTree(evaluationTree);
        collaborationInsights = List.copyOf(collaborationInsights);
        weakAreas = List.copyOf(weakAreas);
        nextSteps = List.copyOf(nextSteps);
        clusterSummaries = SortedMaps.copyOf(clusterSummaries);
        keyRecommendations = List.copyOf(keyRecommendations);
        criticalRisks = List.copyOf(criticalRisks);
        marketInsights = List.copyOf(marketInsights);
    }

    public static ValidationResult fromAggregation(final String runId,
                                                   final Instant timestamp,
                                                   final String ideaName,
                                                   final String ideaConcept,
                                                   final Aggregation aggregation,
                                                   final long processingTimeMs) {
        return new ValidationResult(
                runId,
                timestamp,
                ideaName,
                ideaConcept,
                aggregation.overallScore(),
                aggregation.outcome(),
                aggregation.clusterScores(),
                aggregation.tree(),
                aggregation.consensusLevel(),
                aggregation.collaborationInsights(),
                aggregation.totalSpecialists(),
                processingTimeMs,
                aggregation.weakAreas(),
                aggregation.nextSteps(),
                aggregation.overallSummary(),
                aggregation.clusterSummaries(),
                aggregation.keyRecommendations(),
                aggregation.criticalRisks(),
                aggregation.marketInsights(),
                aggregation.maturityEstimate(),
                aggregation.fallbackCount(),
                null);
    }

    public static ValidationResult fallback(final String runId,
                                            final Instant timestamp,
                                            @Nullable final String ideaName,
                                            @Nullable final String ideaConcept,
                                            final String errorMessage,
                                            final long processingTimeMs) {
        return new ValidationResult(
                runId,
                timestamp,
                StringUtils.defaultString(ideaName),
                StringUtils.defaultString(ideaConcept),
                FALLBACK_SCORE,
                ValidationOutcome.MODERATE,
                new TreeMap<>(),
                new TreeMap<>(),
                0,
                List.of(),
                0,
                processingTimeMs,
                List.of(),
                List.of(),
                "Validation could not be completed: " + errorMessage,
                new TreeMap<>(),
                List.of(),
                List.of(),
                List.of(),
                MaturityEstimate.fromScore(FALLBACK_SCORE),
                0,
                errorMessage);
    }

    public boolean isFallback() {
        return errorMessage != null;
    }
}
