package ideavalidator.domain.prompt;

import ideavalidator.domain.constants.ModelRegex;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

/**
 * Qwen models use the ChatML template.
 */
@ApplicationScoped
public class PromptBuilderQwen implements PromptBuilder {

    @Override
    public String modelRegex() {
        return ModelRegex.QWEN_REGEX;
    }

    @Override
    public String buildContextPrompt(final String title, final String prompt) {
        if (StringUtils.isBlank(prompt)) {
            return "";
        }

        if (StringUtils.isBlank(title)) {
            return "---------------------\n"
                    + prompt
                    + "\n---------------------";
        }

        return "---------------------\n"
                + title + ":\n"
                + prompt
                + "\n---------------------";
    }

    @Override
    public String buildFinalPrompt(@Nullable final String instructions, final String context, final String prompt) {
        if (StringUtils.isBlank(instructions)) {
            return "<|im_start|>system\n"
                    + context
                    + "\n<|im_end|>\n\n"
                    + "<|im_start|>user\n"
                    + prompt
                    + "\n<|im_end|>\n"
                    + "<|im_start|>assistant";
        }

        return "<|im_start|>system\n"
                + instructions
                + "\n"
                + context
                + "\n<|im_end|>\n\n"
                + "<|im_start|>user\n"
                + prompt
                + "\n<|im_end|>\n"
                + "<|im_start|>assistant";
    }
}
