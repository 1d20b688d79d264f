package ideavalidator.infrastructure.mock;

import ideavalidator.domain.injection.Preferred;
import ideavalidator.infrastructure.llm.LlmClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * Makes the mock client the preferred client in tests.
 */
@ApplicationScoped
public class PreferredMockLlmClientProducer {
    @Produces
    @Preferred
    public LlmClient produceLlmClient(final MockLlmClient mockLlmClient) {
        return mockLlmClient;
    }
}
