package ideavalidator.domain.answer;

import ideavalidator.domain.constants.ModelRegex;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;

/**
 * A formatter to remove the thinking part of the Qwen response from the qwen3 model.
 */
@ApplicationScoped
public class AnswerFormatterQwen implements AnswerFormatter {
    @Override
    public String modelRegex() {
        return ModelRegex.QWEN_REGEX;
    }

    @Override
    public String formatAnswer(final String answer) {
        if (StringUtils.isBlank(answer)) {
            return "";
        }

        return answer
                .replaceAll("(?s)<think>.*?</think>", "")
                .replaceAll("(?s)^.*?</think>", "")
                .trim();
    }
}
