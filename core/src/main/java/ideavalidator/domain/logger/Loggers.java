package ideavalidator.domain.logger;

import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.logging.FileHandler;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

@ApplicationScoped
public class Loggers {

    @Inject
    @ConfigProperty(name = "iv.log.file", defaultValue = "false")
    private String logToFile;

    @Nullable
    private FileHandler fileHandler;

    @PostConstruct
    private void init() {
        if (!Boolean.parseBoolean(logToFile)) {
            return;
        }

        System.setProperty("java.util.logging.SimpleFormatter.format", "%4$s: %5$s %n");
        final SimpleFormatter formatter = new SimpleFormatter();
        this.fileHandler = Try.of(() -> new FileHandler("IdeaValidator.log", true))
                .onSuccess(handler -> handler.setFormatter(formatter))
                .getOrNull();
    }

    @Produces
    public Logger getLogger(final InjectionPoint injectionPoint) {
        final Logger logger = Logger.getLogger(
                injectionPoint.getMember().getDeclaringClass().getName());

        if (fileHandler != null && !Arrays.asList(logger.getHandlers()).contains(fileHandler)) {
            logger.addHandler(fileHandler);
        }

        return logger;
    }
}
