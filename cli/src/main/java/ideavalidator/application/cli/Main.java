package ideavalidator.application.cli;

import ideavalidator.Marker;
import ideavalidator.domain.json.JsonDeserializer;
import ideavalidator.domain.logging.LogConfig;
import ideavalidator.domain.orchestrator.ValidationOrchestrator;
import ideavalidator.domain.orchestrator.ValidationResultSerializer;
import io.vavr.control.Try;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;

/**
 * Validates one idea from the command line and prints the result as JSON.
 * <p>
 * Usage: ideavalidator "Idea name" "Idea concept" ['{"Market Opportunity": 2, "Team": 1}']
 */
public class Main {
    @Inject
    private ValidationOrchestrator validationOrchestrator;

    @Inject
    private ValidationResultSerializer validationResultSerializer;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    @ConfigProperty(name = "iv.output.file")
    private Optional<String> file;

    public static void main(final String[] args) {
        LogConfig.init();

        final Weld weld = new Weld();
        /*
        The marker class sits in the shared ancestor package so a recursive scan finds the beans of every module,
        including when they are packaged in an uber JAR.
         */
        try (WeldContainer weldContainer = weld.addBeanClass(Main.class).addPackages(true, Marker.class).initialize()) {
            weldContainer.select(Main.class).get().entry(args);
        }
    }

    public void entry(final String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: ideavalidator <name> <concept> [weights as JSON]");
            return;
        }

        Try.of(() -> validationOrchestrator.validateIdea(args[0], args[1], getWeights(args), null))
                .map(validationResultSerializer::toPrettyJson)
                .onSuccess(System.out::println)
                .onSuccess(this::writeOutput)
                .onFailure(e -> System.err.println("Failed to validate idea: " + e.getMessage()));
    }

    private Map<String, Double> getWeights(final String[] args) {
        if (args.length < 3 || StringUtils.isBlank(args[2])) {
            return Map.of();
        }

        return jsonDeserializer.deserializeMap(args[2], String.class, Double.class);
    }

    private void writeOutput(final String json) {
        if (file.isEmpty()) {
            return;
        }

        Try.run(() -> Files.write(
                        Paths.get(file.get()),
                        json.getBytes(StandardCharsets.UTF_8),
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING))
                .onFailure(e -> System.err.println("Failed to write output to file: " + e.getMessage()));
    }
}
