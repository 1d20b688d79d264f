package ideavalidator.domain.specialist;

import java.util.List;

public record ClusterDefinition(String name, List<ParameterDefinition> parameters) {
    public ClusterDefinition {
        parameters = List.copyOf(parameters);
    }

    public static ClusterDefinition cluster(final String name, final ParameterDefinition... parameters) {
        return new ClusterDefinition(name, List.of(parameters));
    }

    public static ParameterDefinition parameter(final String name, final SubParameterDefinition... subParameters) {
        return new ParameterDefinition(name, List.of(subParameters));
    }

    public static SubParameterDefinition sub(final String name, final int weight, final String... dependencies) {
        return new SubParameterDefinition(name, weight, List.of(dependencies));
    }
}
