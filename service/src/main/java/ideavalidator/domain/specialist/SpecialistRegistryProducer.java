package ideavalidator.domain.specialist;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Builds the registry once from the static catalog.
 */
@ApplicationScoped
public class SpecialistRegistryProducer {

    @Inject
    @ConfigProperty(name = "iv.specialists.limit")
    private Optional<String> limit;

    @Inject
    private Logger logger;

    @Produces
    @ApplicationScoped
    public SpecialistRegistry produceSpecialistRegistry() {
        final OptionalInt specialistLimit = limit
                .filter(NumberUtils::isDigits)
                .map(value -> OptionalInt.of(Integer.parseInt(value)))
                .orElse(OptionalInt.empty());

        final ImmutableSpecialistRegistry registry =
                ImmutableSpecialistRegistry.fromFramework(SpecialistCatalog.framework(), specialistLimit);

        specialistLimit.ifPresent(value ->
                logger.info("Specialist registry limited to the first " + value + " specialists"));

        registry.danglingDependencyNames().forEach(name ->
                logger.warning("Dependency \"" + name + "\" does not name a specialist and will be ignored"));

        logger.info("Loaded " + registry.allSpecialists().size() + " specialists in "
                + registry.clusters().size() + " clusters");

        return registry;
    }
}
