package ideavalidator.domain.aggregate;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Unmodifiable copies of the sorted maps that results expose.
 */
public final class SortedMaps {
    private SortedMaps() {
    }

    public static <K, V> SortedMap<K, V> copyOf(final SortedMap<K, V> map) {
        if (map == null) {
            return Collections.unmodifiableSortedMap(new TreeMap<>());
        }

        return Collections.unmodifiableSortedMap(new TreeMap<>(map));
    }

    /**
     * Copies every level of a cluster, parameter and sub-parameter tree.
     */
    public static <V> SortedMap<String, SortedMap<String, SortedMap<String, V>>> copyOfTree(
            final SortedMap<String, SortedMap<String, SortedMap<String, V>>> tree) {
        final SortedMap<String, SortedMap<String, SortedMap<String, V>>> copy = new TreeMap<>();
        if (tree != null) {
            tree.forEach((cluster, parameters) -> {
                final SortedMap<String, SortedMap<String, V>> parametersCopy = new TreeMap<>();
                parameters.forEach((parameter, subParameters) -> parametersCopy.put(parameter, copyOf(subParameters)));
                copy.put(cluster, Collections.unmodifiableSortedMap(parametersCopy));
            });
        }
        return Collections.unmodifiableSortedMap(copy);
    }
}
