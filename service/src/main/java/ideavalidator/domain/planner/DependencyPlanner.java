package ideavalidator.domain.planner;

import ideavalidator.domain.specialist.SpecialistRegistry;

/**
 * Turns the dependency declarations of a registry into waves of specialists that can run concurrently.
 */
public interface DependencyPlanner {
    /**
     * @param registry The specialists to plan
     * @return The waves, where every specialist appears after all the specialists it depends on
     * @throws ideavalidator.domain.exceptions.CyclicDependency if the dependencies can never be satisfied
     */
    ExecutionPlan plan(SpecialistRegistry registry);
}
