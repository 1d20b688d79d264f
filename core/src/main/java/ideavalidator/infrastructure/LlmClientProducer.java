package ideavalidator.infrastructure;

import ideavalidator.domain.injection.Preferred;
import ideavalidator.infrastructure.llm.LlmClient;
import ideavalidator.infrastructure.mock.MockLlmClient;
import ideavalidator.infrastructure.ollama.OllamaClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Produces a LlmClient instance based on the configuration.
 */
@ApplicationScoped
public class LlmClientProducer {

    @Inject
    @ConfigProperty(name = "iv.llm.client", defaultValue = "ollama")
    private String client;

    @Produces
    @Preferred
    @ApplicationScoped
    public LlmClient produceLlmClient(final Instance<OllamaClient> ollamaClient,
                                      final Instance<MockLlmClient> mockClient) {
        if ("mock".equalsIgnoreCase(client)) {
            return mockClient.get();
        }

        return ollamaClient.get();
    }
}
