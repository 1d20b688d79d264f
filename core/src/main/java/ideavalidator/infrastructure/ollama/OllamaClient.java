package ideavalidator.infrastructure.ollama;

import ideavalidator.domain.answer.AnswerFormatterService;
import ideavalidator.domain.concurrency.SemaphoreLender;
import ideavalidator.domain.config.ModelConfig;
import ideavalidator.domain.exceptions.FailedOllama;
import ideavalidator.domain.exceptions.InvalidResponse;
import ideavalidator.domain.exceptions.MissingResponse;
import ideavalidator.domain.response.ResponseValidation;
import ideavalidator.infrastructure.llm.GenerationOptions;
import ideavalidator.infrastructure.llm.LlmClient;
import ideavalidator.infrastructure.ollama.api.OllamaGenerateBody;
import ideavalidator.infrastructure.ollama.api.OllamaGenerateBodyOptions;
import ideavalidator.infrastructure.ollama.api.OllamaResponse;
import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

@ApplicationScoped
public class OllamaClient implements LlmClient {
    private static final long CONNECT_TIMEOUT_SECONDS = 10;

    @Inject
    @ConfigProperty(name = "iv.ollama.url", defaultValue = "http://localhost:11434")
    private String uri;

    @Inject
    @ConfigProperty(name = "iv.ollama.retries", defaultValue = "1")
    private String retries;

    @Inject
    @ConfigProperty(name = "iv.ollama.retrydelayms", defaultValue = "1000")
    private String retryDelay;

    @Inject
    @ConfigProperty(name = "iv.ollama.maxconcurrent", defaultValue = "10")
    private String maxConcurrent;

    @Inject
    private ResponseValidation responseValidation;

    @Inject
    private AnswerFormatterService answerFormatterService;

    @Inject
    private ModelConfig modelConfig;

    @Inject
    private Logger logger;

    private SemaphoreLender semaphoreLender;

    @PostConstruct
    private void init() {
        semaphoreLender = new SemaphoreLender(Math.max(1, NumberUtils.toInt(maxConcurrent, 10)));
    }

    @Override
    public String call(final String prompt) {
        checkArgument(StringUtils.isNotBlank(prompt));

        return call(prompt, new GenerationOptions(
                modelConfig.getModel(),
                modelConfig.getMaxTokens(),
                modelConfig.getTemperature(),
                modelConfig.getRequestTimeout()));
    }

    @Override
    public String call(final String prompt, final GenerationOptions options) {
        checkArgument(StringUtils.isNotBlank(prompt));
        checkNotNull(options);

        final String model = StringUtils.defaultIfBlank(options.model(), modelConfig.getModel());

        final OllamaGenerateBody body = new OllamaGenerateBody(
                model,
                prompt,
                false,
                new OllamaGenerateBodyOptions(
                        options.temperature(),
                        options.maxTokens(),
                        modelConfig.getContextWindow().orElse(null)));

        // Retries share the call's timeout rather than each getting a fresh one
        final Instant deadline = Instant.now().plus(options.timeout());

        return callOllama(body, deadline, 0).response();
    }

    private Client buildClient(final Duration timeout) {
        final long timeoutMillis = Math.max(1, timeout.toMillis());

        return ClientBuilder.newBuilder()
                .connectTimeout(Math.min(TimeUnit.SECONDS.toMillis(CONNECT_TIMEOUT_SECONDS), timeoutMillis), TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
    }

    /**
     * vavr rethrows an InterruptedException from Try.run, so the sleep is handled here instead.
     *
     * @return false if the thread was interrupted
     */
    private static boolean pause(final long delayMillis) {
        try {
            Thread.sleep(delayMillis);
            return true;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Call Ollama with the given body. The number of concurrent calls is bounded by the semaphore lender.
     */
    private OllamaResponse callOllama(final OllamaGenerateBody body, final Instant deadline, final int retryCount) {
        final int maxRetries = Math.max(0, NumberUtils.toInt(retries, 1));
        final long delay = Math.max(0, NumberUtils.toLong(retryDelay, 1000L));

        logger.fine("Calling: " + uri);
        logger.fine("Called with model: " + body.model());

        final String target = uri + "/api/generate";

        return Try.withResources(() -> buildClient(Duration.between(Instant.now(), deadline)))
                .of(client -> post(client, target, body))
                .recoverWith(ex -> {
                    if (!canRetry(retryCount, maxRetries, Duration.between(Instant.now(), deadline), delay)) {
                        return Try.<OllamaResponse>failure(new FailedOllama("OllamaClient failed to call Ollama after "
                                + (retryCount + 1) + " attempts: " + ex.getMessage(), ex));
                    }

                    logger.warning("Retrying Ollama call, attempt " + (retryCount + 1) + ": " + ex.getMessage());
                    if (!pause(delay)) {
                        return Try.<OllamaResponse>failure(new FailedOllama("OllamaClient was interrupted before retrying", ex));
                    }
                    return Try.of(() -> callOllama(body, deadline, retryCount + 1));
                })
                .get();
    }

    private OllamaResponse post(final Client client, final String target, final OllamaGenerateBody body) {
        return Try.withResources(
                        semaphoreLender::lend,
                        () -> client.target(target)
                                .request()
                                .header("Content-Type", "application/json")
                                .header("Accept", "application/json")
                                .post(Entity.entity(body.sanitizedCopy(), MediaType.APPLICATION_JSON)))
                .of((permit, response) -> readResponse(response, target, body))
                .get();
    }

    /**
     * A retry only makes sense if there are attempts left and the delay still leaves time before the deadline.
     */
    static boolean canRetry(final int retryCount, final int maxRetries, final Duration remaining, final long delayMillis) {
        return retryCount < maxRetries && remaining.toMillis() > delayMillis;
    }

    private OllamaResponse readResponse(final Response response, final String target, final OllamaGenerateBody body) {
        return Try.of(() -> responseValidation.validate(response, target))
                .recover(InvalidResponse.class, e -> {
                    throw new FailedOllama("OllamaClient failed to call Ollama:\n"
                            + e.getCode() + "\n"
                            + e.getBody(), e);
                })
                .recover(MissingResponse.class, e -> {
                    throw new FailedOllama("OllamaClient failed to call Ollama: " + e.getMessage()
                            + "\nMake sure to run 'ollama pull " + body.model() + "'", e);
                })
                .map(r -> r.readEntity(OllamaResponse.class))
                .map(ollamaResponse -> ollamaResponse.replaceResponse(
                        answerFormatterService.formatResponse(body.model(), ollamaResponse.response())))
                .get();
    }
}
