package ideavalidator.domain.specialist;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable catalog of evaluation specialists, safe to share between threads.
 */
public interface SpecialistRegistry {
    /**
     * @return Every specialist in declaration order
     */
    List<Specialist> allSpecialists();

    /**
     * Resolves a dependency name to the specialists that score that sub-parameter. One name can map to
     * several specialists when the same sub-parameter appears under more than one parameter.
     *
     * @param name The sub-parameter name
     * @return The matching specialists in declaration order, or an empty list for a dangling reference
     */
    List<Specialist> byDependencyName(String name);

    Optional<Specialist> findById(String id);

    /**
     * @return The clusters that have at least one specialist, in declaration order
     */
    List<String> clusters();

    /**
     * @return Dependency names that match no specialist, such as references to a whole parameter
     */
    Set<String> danglingDependencyNames();

    /**
     * @return The number of specialists with at least one dependency
     */
    int dependencyCount();

    FrameworkInfo frameworkInfo();
}
