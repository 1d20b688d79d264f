package ideavalidator.domain.specialist;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An evaluator of one sub-parameter. Specialists are created once from the catalog and never change.
 *
 * @param id           The unique identity, e.g. agent_001_originality
 * @param cluster      The top level category, e.g. Core Idea
 * @param parameter    The group within the cluster, e.g. Novelty &amp; Uniqueness
 * @param subParameter The narrow aspect this specialist scores, e.g. Originality
 * @param weight       The relative weight of the sub-parameter within its parameter
 * @param dependencies The sub-parameter names whose results should be available first
 * @param role         The persona the specialist adopts
 * @param goal         What the specialist is asked to achieve
 * @param backstory    The expertise the specialist claims
 */
public record Specialist(String id,
                         String cluster,
                         String parameter,
                         String subParameter,
                         int weight,
                         List<String> dependencies,
                         String role,
                         String goal,
                         String backstory) {
    public Specialist {
        checkArgument(id != null && !id.isBlank(), "id must not be blank");
        checkNotNull(cluster);
        checkNotNull(parameter);
        checkNotNull(subParameter);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }
}
