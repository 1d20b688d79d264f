package ideavalidator.domain.specialist;

import ideavalidator.domain.exceptions.InvalidRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A registry whose indexes are built once at construction and never modified afterwards.
 */
public final class ImmutableSpecialistRegistry implements SpecialistRegistry {
    private final List<Specialist> specialists;
    private final Map<String, List<Specialist>> byName;
    private final Map<String, Specialist> byId;
    private final List<String> clusters;
    private final Set<String> dangling;

    private ImmutableSpecialistRegistry(final List<Specialist> specialists, final Set<String> knownLabels) {
        this.specialists = List.copyOf(specialists);

        final Map<String, List<Specialist>> names = new LinkedHashMap<>();
        final Map<String, Specialist> ids = new LinkedHashMap<>();
        final Set<String> clusterNames = new LinkedHashSet<>();
        for (final Specialist specialist : this.specialists) {
            names.computeIfAbsent(specialist.subParameter(), k -> new ArrayList<>()).add(specialist);
            if (ids.putIfAbsent(specialist.id(), specialist) != null) {
                throw new InvalidRegistry("Duplicate specialist id " + specialist.id());
            }
            clusterNames.add(specialist.cluster());
        }

        this.byName = names.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
        this.byId = Collections.unmodifiableMap(ids);
        this.clusters = List.copyOf(clusterNames);

        final Set<String> unresolved = new LinkedHashSet<>();
        for (final Specialist specialist : this.specialists) {
            for (final String dependency : specialist.dependencies()) {
                if (byName.containsKey(dependency)) {
                    continue;
                }
                if (!knownLabels.contains(dependency)) {
                    throw new InvalidRegistry("Specialist " + specialist.id()
                            + " depends on unknown name \"" + dependency + "\"");
                }
                unresolved.add(dependency);
            }
        }
        this.dangling = Collections.unmodifiableSet(unresolved);
    }

    /**
     * Builds the registry from the full framework.
     *
     * @param framework The clusters to load
     * @param limit     When present, only the first N specialists are kept
     */
    public static ImmutableSpecialistRegistry fromFramework(final List<ClusterDefinition> framework, final OptionalInt limit) {
        checkNotNull(framework);
        checkNotNull(limit);
        checkArgument(limit.isEmpty() || limit.getAsInt() >= 0, "limit must not be negative");

        final Set<String> knownLabels = new HashSet<>();
        final List<Specialist> specialists = new ArrayList<>();
        int count = 0;
        for (final ClusterDefinition cluster : framework) {
            knownLabels.add(cluster.name());
            for (final ParameterDefinition parameter : cluster.parameters()) {
                knownLabels.add(parameter.name());
                for (final SubParameterDefinition sub : parameter.subParameters()) {
                    knownLabels.add(sub.name());
                    ++count;
                    specialists.add(new Specialist(
                            specialistId(count, sub.name()),
                            cluster.name(),
                            parameter.name(),
                            sub.name(),
                            sub.weight(),
                            sub.dependencies(),
                            SpecialistPersonas.role(sub.name()),
                            SpecialistPersonas.goal(cluster.name(), sub.name()),
                            SpecialistPersonas.backstory(cluster.name(), sub.name())));
                }
            }
        }

        final List<Specialist> kept = limit.isPresent() && limit.getAsInt() < specialists.size()
                ? specialists.subList(0, limit.getAsInt())
                : specialists;

        return new ImmutableSpecialistRegistry(kept, knownLabels);
    }

    /**
     * Builds a registry from specialists that have already been created. Dependency names may refer to any
     * sub-parameter, parameter or cluster of the given specialists.
     */
    public static ImmutableSpecialistRegistry of(final List<Specialist> specialists) {
        checkNotNull(specialists);

        final Set<String> knownLabels = new HashSet<>();
        for (final Specialist specialist : specialists) {
            knownLabels.add(specialist.cluster());
            knownLabels.add(specialist.parameter());
            knownLabels.add(specialist.subParameter());
        }

        return new ImmutableSpecialistRegistry(specialists, knownLabels);
    }

    /**
     * Builds ids like agent_015_market_size_tam.
     */
    public static String specialistId(final int position, final String subParameter) {
        final String slug = subParameter.toLowerCase(Locale.ROOT)
                .replaceAll("[()]", "")
                .replaceAll("[\\s/&\\-]+", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
        return String.format(Locale.ROOT, "agent_%03d_%s", position, slug);
    }

    @Override
    public List<Specialist> allSpecialists() {
        return specialists;
    }

    @Override
    public List<Specialist> byDependencyName(final String name) {
        if (name == null) {
            return List.of();
        }
        return byName.getOrDefault(name, List.of());
    }

    @Override
    public Optional<Specialist> findById(final String id) {
        return Optional.ofNullable(id).map(byId::get);
    }

    @Override
    public List<String> clusters() {
        return clusters;
    }

    @Override
    public Set<String> danglingDependencyNames() {
        return dangling;
    }

    @Override
    public int dependencyCount() {
        return (int) specialists.stream().filter(Specialist::hasDependencies).count();
    }

    @Override
    public FrameworkInfo frameworkInfo() {
        final Map<String, Integer> perCluster = specialists.stream()
                .collect(Collectors.groupingBy(Specialist::cluster, Collectors.summingInt(s -> 1)));

        return new FrameworkInfo(specialists.size(), clusters, perCluster, dependencyCount());
    }
}
