package ideavalidator.infrastructure.ollama.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaResponse(String model,
                             String created_at,
                             String done,
                             String done_reason,
                             String total_duration,
                             String eval_count,
                             String response) {
    public OllamaResponse replaceResponse(final String response) {
        return new OllamaResponse(model, created_at, done, done_reason, total_duration, eval_count, response);
    }
}
