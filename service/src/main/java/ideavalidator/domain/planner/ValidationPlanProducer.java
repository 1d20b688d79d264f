package ideavalidator.domain.planner;

import ideavalidator.domain.specialist.SpecialistRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.event.Startup;
import jakarta.inject.Inject;

import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Plans the registry once. Observing the startup event means an invalid registry or a dependency cycle
 * stops the container from starting rather than failing the first validation run.
 */
@ApplicationScoped
public class ValidationPlanProducer {

    @Inject
    private SpecialistRegistry registry;

    @Inject
    private DependencyPlanner planner;

    @Inject
    private Logger logger;

    private volatile ExecutionPlan plan;

    void onStartup(@Observes final Startup event) {
        getPlan();
    }

    public ExecutionPlan getPlan() {
        if (plan == null) {
            synchronized (this) {
                if (plan == null) {
                    final ExecutionPlan newPlan = planner.plan(registry);
                    logger.info("Planned " + newPlan.specialistCount() + " specialists in " + newPlan.waves().size()
                            + " waves: " + newPlan.waves().stream()
                            .map(wave -> String.valueOf(wave.size()))
                            .collect(Collectors.joining(", ")));
                    plan = newPlan;
                }
            }
        }

        return plan;
    }
}
