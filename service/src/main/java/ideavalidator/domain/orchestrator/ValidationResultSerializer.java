package ideavalidator.domain.orchestrator;

import ideavalidator.domain.json.JsonDeserializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Renders results as the JSON consumed by storage and reporting.
 */
@ApplicationScoped
public class ValidationResultSerializer {

    @Inject
    private JsonDeserializer jsonDeserializer;

    public String toJson(final ValidationResult result) {
        checkNotNull(result);
        return jsonDeserializer.serialize(result);
    }

    public String toPrettyJson(final ValidationResult result) {
        checkNotNull(result);
        return jsonDeserializer.serializePretty(result);
    }
}
