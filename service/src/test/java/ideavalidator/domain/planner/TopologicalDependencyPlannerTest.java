package ideavalidator.domain.planner;

import ideavalidator.domain.exceptions.CyclicDependency;
import ideavalidator.domain.logger.Loggers;
import ideavalidator.domain.specialist.ImmutableSpecialistRegistry;
import ideavalidator.domain.specialist.Specialist;
import ideavalidator.domain.specialist.SpecialistCatalog;
import ideavalidator.domain.specialist.SpecialistRegistry;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(TopologicalDependencyPlanner.class)
@AddBeanClasses(Loggers.class)
class TopologicalDependencyPlannerTest {

    @Inject
    private DependencyPlanner planner;

    private static Specialist specialist(final String id, final String subParameter, final String... dependencies) {
        return new Specialist(id, "Cluster", "Parameter", subParameter, 10, List.of(dependencies),
                "role", "goal", "backstory");
    }

    private static List<String> ids(final Wave wave) {
        return wave.specialists().stream().map(Specialist::id).toList();
    }

    @Test
    void testChainProducesOneWavePerLink() {
        final SpecialistRegistry registry = ImmutableSpecialistRegistry.of(List.of(
                specialist("c", "C", "B"),
                specialist("a", "A"),
                specialist("b", "B", "A")));

        final ExecutionPlan plan = planner.plan(registry);

        assertEquals(3, plan.waves().size());
        assertEquals(List.of("a"), ids(plan.waves().get(0)));
        assertEquals(List.of("b"), ids(plan.waves().get(1)));
        assertEquals(List.of("c"), ids(plan.waves().get(2)));
    }

    @Test
    void testIndependentSpecialistsShareTheFirstWave() {
        final SpecialistRegistry registry = ImmutableSpecialistRegistry.of(List.of(
                specialist("a", "A"),
                specialist("b", "B"),
                specialist("c", "C", "A")));

        final ExecutionPlan plan = planner.plan(registry);

        assertEquals(List.of("a", "b"), ids(plan.waves().get(0)));
        assertEquals(List.of("c"), ids(plan.waves().get(1)));
    }

    @Test
    void testSharedNameWaitsForEveryOwner() {
        final SpecialistRegistry registry = ImmutableSpecialistRegistry.of(List.of(
                specialist("a", "Base"),
                specialist("b1", "Shared"),
                specialist("b2", "Shared", "Base"),
                specialist("c", "Consumer", "Shared")));

        final ExecutionPlan plan = planner.plan(registry);

        assertEquals(2, plan.waveOf("c").orElseThrow().index());
        assertEquals(2, plan.dependenciesOf("c").get("Shared").size());
    }

    @Test
    void testSelfReferenceIgnored() {
        final SpecialistRegistry registry = ImmutableSpecialistRegistry.of(List.of(
                specialist("a", "A", "A")));

        final ExecutionPlan plan = planner.plan(registry);

        assertEquals(1, plan.waves().size());
        assertTrue(plan.dependenciesOf("a").isEmpty());
    }

    @Test
    void testDanglingReferencePlannedAsIndependent() {
        // "Cluster" is a cluster label rather than a sub-parameter
        final SpecialistRegistry registry = ImmutableSpecialistRegistry.of(List.of(
                specialist("a", "A", "Cluster")));

        final ExecutionPlan plan = planner.plan(registry);

        assertEquals(List.of("a"), ids(plan.waves().get(0)));
    }

    @Test
    void testCycleRejected() {
        final SpecialistRegistry registry = ImmutableSpecialistRegistry.of(List.of(
                specialist("a", "A", "C"),
                specialist("b", "B", "A"),
                specialist("c", "C", "B"),
                specialist("d", "D")));

        final CyclicDependency exception = assertThrows(CyclicDependency.class, () -> planner.plan(registry));
        assertTrue(exception.getMessage().contains("a"));
    }

    @Test
    void testFullCatalog() {
        final SpecialistRegistry registry =
                ImmutableSpecialistRegistry.fromFramework(SpecialistCatalog.framework(), OptionalInt.empty());

        final ExecutionPlan plan = planner.plan(registry);

        assertEquals(109, plan.specialistCount());
        assertEquals(List.of(29, 44, 28, 5, 2, 1), plan.waves().stream().map(Wave::size).toList());

        // Every resolved dependency runs in an earlier wave
        for (final Wave wave : plan.waves()) {
            for (final Specialist specialist : wave.specialists()) {
                plan.dependenciesOf(specialist.id()).values().stream()
                        .flatMap(List::stream)
                        .forEach(owner -> assertTrue(plan.waveOf(owner.id()).orElseThrow().index() < wave.index()));
            }
        }
    }

    @Test
    void testPlanIsDeterministic() {
        final SpecialistRegistry registry =
                ImmutableSpecialistRegistry.fromFramework(SpecialistCatalog.framework(), OptionalInt.empty());

        assertEquals(planner.plan(registry).waves(), planner.plan(registry).waves());
    }
}
