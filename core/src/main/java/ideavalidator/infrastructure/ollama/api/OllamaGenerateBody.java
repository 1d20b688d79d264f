package ideavalidator.infrastructure.ollama.api;

import org.apache.commons.lang3.StringUtils;

public record OllamaGenerateBody(String model, String prompt, Boolean stream, OllamaGenerateBodyOptions options) {

    public OllamaGenerateBody sanitizedCopy() {
        return new OllamaGenerateBody(StringUtils.trim(model), StringUtils.trim(prompt), stream, options);
    }
}
