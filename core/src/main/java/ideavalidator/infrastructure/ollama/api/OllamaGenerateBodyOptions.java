package ideavalidator.infrastructure.ollama.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OllamaGenerateBodyOptions(@Nullable Double temperature,
                                        @Nullable Integer num_predict,
                                        @Nullable Integer num_ctx) {
}
