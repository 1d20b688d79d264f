package ideavalidator.domain.specialist;

import java.util.List;
import java.util.Map;

/**
 * A summary of the loaded framework, used for health and status reporting.
 */
public record FrameworkInfo(int totalSpecialists,
                            List<String> clusters,
                            Map<String, Integer> specialistsPerCluster,
                            int dependencyCount) {
    public FrameworkInfo {
        clusters = List.copyOf(clusters);
        specialistsPerCluster = Map.copyOf(specialistsPerCluster);
    }
}
