package ideavalidator.domain.specialist;

import java.util.List;

public record SubParameterDefinition(String name, int weight, List<String> dependencies) {
    public SubParameterDefinition {
        dependencies = List.copyOf(dependencies);
    }
}
