package ideavalidator.domain.aggregate;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A sub-parameter that scored below the weak area threshold.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WeakArea(String specialistId,
                       String cluster,
                       String parameter,
                       String subParameter,
                       double score,
                       String explanation,
                       List<String> recommendations) {
    public WeakArea {
        recommendations = List.copyOf(recommendations);
    }
}
