package ideavalidator.domain.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The idea being validated.
 *
 * @param name    The short name of the idea
 * @param concept The free text description of the idea
 * @param weights Optional relative weights keyed by cluster name. Empty means every cluster counts equally.
 */
public record Proposal(String name, String concept, Map<String, Double> weights) {
    public Proposal {
        checkArgument(name != null && !name.isBlank(), "name must not be blank");
        checkArgument(concept != null && !concept.isBlank(), "concept must not be blank");

        final Map<String, Double> copy = new LinkedHashMap<>();
        if (weights != null) {
            weights.forEach((key, value) -> {
                // NaN and infinite weights would poison the weighted mean
                if (key != null && value != null && Double.isFinite(value)) {
                    copy.put(key, value);
                }
            });
        }
        weights = Map.copyOf(copy);
    }

    public Proposal(final String name, final String concept) {
        this(name, concept, Map.of());
    }

    public boolean hasCustomWeights() {
        return !weights.isEmpty();
    }
}
