package ideavalidator.infrastructure.mock;

import ideavalidator.infrastructure.llm.GenerationOptions;
import ideavalidator.infrastructure.llm.LlmClient;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * A deterministic stand-in for the inference service. Either returns a fixed response, or delegates to a
 * function of the prompt, which may also throw to simulate a failing service.
 */
@ApplicationScoped
public class MockLlmClient implements LlmClient {

    @Nullable
    private volatile String mockResponse;

    @Nullable
    private volatile Function<String, String> responder;

    private final AtomicInteger callCount = new AtomicInteger();

    public void setMockResponse(@Nullable final String response) {
        this.mockResponse = response;
    }

    public void setResponder(@Nullable final Function<String, String> responder) {
        this.responder = responder;
    }

    public int getCallCount() {
        return callCount.get();
    }

    public void reset() {
        mockResponse = null;
        responder = null;
        callCount.set(0);
    }

    @Override
    public String call(final String prompt) {
        callCount.incrementAndGet();

        final Function<String, String> currentResponder = responder;
        if (currentResponder != null) {
            return Objects.requireNonNullElse(currentResponder.apply(prompt), "");
        }

        return Objects.requireNonNullElse(mockResponse, "");
    }

    @Override
    public String call(final String prompt, final GenerationOptions options) {
        return call(prompt);
    }
}
