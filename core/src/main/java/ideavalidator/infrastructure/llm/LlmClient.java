package ideavalidator.infrastructure.llm;

/**
 * The language-model inference service. Implementations are unreliable external dependencies:
 * callers must expect timeouts, malformed output and outright errors.
 */
public interface LlmClient {
    String call(String prompt);

    String call(String prompt, GenerationOptions options);
}
