package ideavalidator.domain.prompt;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.util.regex.Pattern;

/**
 * Provides a way to select the correct prompt builder based on the model.
 * Models without a dedicated template get the plain builder.
 */
@ApplicationScoped
public class PromptBuilderSelector {

    @Inject
    @Any
    private Instance<PromptBuilder> builders;

    @Inject
    private PromptBuilderPlain plainBuilder;

    public PromptBuilder getPromptBuilder(final String model) {
        return builders.stream()
                .filter(b -> Try.of(() -> Pattern.compile(b.modelRegex()).matcher(model).matches())
                        .getOrElse(false))
                .findFirst()
                .orElse(plainBuilder);
    }
}
