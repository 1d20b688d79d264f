package ideavalidator.domain.planner;

import ideavalidator.domain.specialist.Specialist;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The ordered waves of a validation run, along with the resolved dependencies of each specialist.
 *
 * @param waves        The waves in execution order
 * @param dependencies Maps a specialist id to the specialists it waits for, keyed by dependency name
 */
public record ExecutionPlan(List<Wave> waves, Map<String, Map<String, List<Specialist>>> dependencies) {
    public ExecutionPlan {
        waves = List.copyOf(waves);
        dependencies = Map.copyOf(dependencies);
    }

    public int specialistCount() {
        return waves.stream().mapToInt(Wave::size).sum();
    }

    public Optional<Wave> waveOf(final String specialistId) {
        return waves.stream()
                .filter(wave -> wave.specialists().stream().anyMatch(s -> s.id().equals(specialistId)))
                .findFirst();
    }

    /**
     * @return The resolved dependencies of the specialist, keyed by the dependency name it declared
     */
    public Map<String, List<Specialist>> dependenciesOf(final String specialistId) {
        return dependencies.getOrDefault(specialistId, Map.of());
    }
}
