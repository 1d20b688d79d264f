package ideavalidator.domain.aggregate;

import ideavalidator.domain.evaluation.EvaluationRecord;

import java.util.List;
import java.util.SortedMap;

/**
 * The derived view of a run's records. Every map is sorted by key so the shape never depends on the
 * order records arrived in, and every map and list is an unmodifiable copy.
 */
public record Aggregation(double overallScore,
                          ValidationOutcome outcome,
                          SortedMap<String, Double> clusterScores,
                          SortedMap<String, SortedMap<String, SortedMap<String, EvaluationRecord>>> tree,
                          double consensusLevel,
                          List<String> collaborationInsights,
                          List<WeakArea> weakAreas,
                          List<WeakArea> nextSteps,
                          String overallSummary,
                          SortedMap<String, ClusterSummary> clusterSummaries,
                          List<String> keyRecommendations,
                          List<String> criticalRisks,
                          List<String> marketInsights,
                          MaturityEstimate maturityEstimate,
                          int totalSpecialists,
                          int fallbackCount) {
    public Aggregation {
        clusterScores = SortedMaps.copyOf(clusterScores);
        tree = SortedMaps.copyOfTree(tree);
        clusterSummaries = SortedMaps.copyOf(clusterSummaries);
        collaborationInsights = List.copyOf(collaborationInsights);
        weakAreas = List.copyOf(weakAreas);
        nextSteps = List.copyOf(nextSteps);
        keyRecommendations = List.copyOf(keyRecommendations);
        criticalRisks = List.copyOf(criticalRisks);
        marketInsights = List.copyOf(marketInsights);
    }
}
