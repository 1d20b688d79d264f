package ideavalidator.domain.planner;

import ideavalidator.domain.exceptions.CyclicDependency;
import ideavalidator.domain.specialist.Specialist;
import ideavalidator.domain.specialist.SpecialistRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Levels the dependency graph. A specialist with no resolvable dependency lands in wave 0, and every other
 * specialist lands one wave after the latest of its dependencies.
 */
@ApplicationScoped
public class TopologicalDependencyPlanner implements DependencyPlanner {

    @Inject
    private Logger logger;

    @Override
    public ExecutionPlan plan(final SpecialistRegistry registry) {
        checkNotNull(registry);

        final List<Specialist> specialists = registry.allSpecialists();
        final Map<String, Map<String, List<Specialist>>> resolved = new HashMap<>();

        for (final Specialist specialist : specialists) {
            final Map<String, List<Specialist>> byName = new LinkedHashMap<>();
            for (final String dependency : specialist.dependencies()) {
                final List<Specialist> owners = registry.byDependencyName(dependency).stream()
                        .filter(owner -> !owner.id().equals(specialist.id()))
                        .toList();

                if (owners.isEmpty()) {
                    if (registry.byDependencyName(dependency).isEmpty()) {
                        logger.warning("Specialist " + specialist.id() + " depends on \"" + dependency
                                + "\", which matches no specialist. Planning it as if it had no dependency.");
                    }
                    continue;
                }

                byName.put(dependency, owners);
            }
            resolved.put(specialist.id(), byName);
        }

        final Map<String, Integer> levels = new HashMap<>();
        final Set<String> remaining = specialists.stream()
                .map(Specialist::id)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        // Each pass places every specialist whose dependencies are all placed, so the number of passes
        // is bounded by the length of the longest chain.
        boolean progress = true;
        while (!remaining.isEmpty() && progress) {
            progress = false;
            final Map<String, Integer> placedThisPass = new HashMap<>();
            for (final String id : remaining) {
                final List<Specialist> upstream = resolved.get(id).values().stream()
                        .flatMap(List::stream)
                        .toList();

                if (upstream.stream().allMatch(owner -> levels.containsKey(owner.id()))) {
                    final int level = upstream.stream()
                            .mapToInt(owner -> levels.get(owner.id()) + 1)
                            .max()
                            .orElse(0);
                    placedThisPass.put(id, level);
                }
            }

            if (!placedThisPass.isEmpty()) {
                levels.putAll(placedThisPass);
                remaining.removeAll(placedThisPass.keySet());
                progress = true;
            }
        }

        if (!remaining.isEmpty()) {
            throw new CyclicDependency("Dependencies can never be satisfied for " + String.join(", ", remaining));
        }

        final TreeMap<Integer, List<Specialist>> grouped = new TreeMap<>();
        for (final Specialist specialist : specialists) {
            grouped.computeIfAbsent(levels.get(specialist.id()), k -> new ArrayList<>()).add(specialist);
        }

        final List<Wave> waves = grouped.entrySet().stream()
                .map(entry -> new Wave(entry.getKey(), entry.getValue()))
                .toList();

        return new ExecutionPlan(waves, resolved);
    }
}
