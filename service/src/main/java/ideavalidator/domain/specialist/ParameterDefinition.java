package ideavalidator.domain.specialist;

import java.util.List;

public record ParameterDefinition(String name, List<SubParameterDefinition> subParameters) {
    public ParameterDefinition {
        subParameters = List.copyOf(subParameters);
    }
}
