package ideavalidator.domain.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The already resolved records a specialist may consult, keyed by the dependency name it declared.
 * A name owned by several specialists maps to every owner's record.
 */
public record DependencyContext(Map<String, List<EvaluationRecord>> records) {
    public DependencyContext {
        final Map<String, List<EvaluationRecord>> copy = new LinkedHashMap<>();
        if (records != null) {
            records.forEach((name, list) -> {
                if (list != null && !list.isEmpty()) {
                    copy.put(name, List.copyOf(list));
                }
            });
        }
        records = Collections.unmodifiableMap(copy);
    }

    public static DependencyContext empty() {
        return new DependencyContext(Map.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Summarises each dependency by score and explanation only. The full record text is left out to
     * keep prompts short.
     */
    public String summary() {
        return records.entrySet().stream()
                .flatMap(entry -> entry.getValue().stream()
                        .map(record -> "- " + entry.getKey() + " (" + record.parameter() + "): Score "
                                + String.format(Locale.ROOT, "%.1f", record.score())
                                + "/100. " + record.explanation()))
                .collect(Collectors.joining("\n"));
    }
}
