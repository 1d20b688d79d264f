package ideavalidator.domain.aggregate;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClusterSummary(String cluster,
                             double score,
                             ValidationOutcome status,
                             List<String> strongAreas,
                             List<String> improvementOpportunities,
                             String assessment) {
    public ClusterSummary {
        strongAreas = List.copyOf(strongAreas);
        improvementOpportunities = List.copyOf(improvementOpportunities);
    }
}
