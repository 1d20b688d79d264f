package ideavalidator.domain.answer;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.util.logging.Logger;
import java.util.regex.Pattern;

@ApplicationScoped
public class DefaultAnswerFormatterService implements AnswerFormatterService {
    @Inject
    private Instance<AnswerFormatter> answerFormatters;

    @Inject
    private Logger logger;

    @Override
    public String formatResponse(final String model, final String response) {
        if (StringUtils.isBlank(model)) {
            return StringUtils.defaultString(response);
        }

        return answerFormatters.stream()
                // Regexes might be invalid, just treat them as a false match
                .filter(b -> Try.of(() -> Pattern.compile(b.modelRegex()).matcher(model).matches())
                        .onFailure(e -> logger.warning("Invalid regex for model " + model + ": " + b.modelRegex() + ". Error: " + e.getMessage()))
                        .getOrElse(false))
                .findFirst()
                .map(formatter -> formatter.formatAnswer(response))
                .orElse(StringUtils.defaultString(response));
    }
}
