package ideavalidator.domain.evaluation;

import ideavalidator.domain.config.ModelConfig;
import ideavalidator.domain.exceptionhandling.ExceptionHandler;
import ideavalidator.domain.exceptionhandling.ExceptionMapping;
import ideavalidator.domain.injection.Preferred;
import ideavalidator.domain.specialist.Specialist;
import ideavalidator.infrastructure.llm.GenerationOptions;
import ideavalidator.infrastructure.llm.LlmClient;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

@ApplicationScoped
public class LlmSpecialistInvoker implements SpecialistInvoker {

    @Inject
    @Preferred
    private LlmClient llmClient;

    @Inject
    private ModelConfig modelConfig;

    @Inject
    private SpecialistPromptBuilder promptBuilder;

    @Inject
    private EvaluationResponseParser responseParser;

    @Inject
    private EvaluationRepair evaluationRepair;

    @Inject
    private ExceptionMapping exceptionMapping;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @Override
    public EvaluationRecord invoke(final Specialist specialist,
                                   final Proposal proposal,
                                   final DependencyContext context,
                                   final Instant deadline) {
        checkNotNull(specialist);
        checkNotNull(deadline);

        final Instant started = Instant.now();
        final Duration remaining = Duration.between(started, deadline);

        if (remaining.isNegative() || remaining.isZero()) {
            logger.warning("Run deadline passed before " + specialist.id() + " could be called");
            return evaluationRepair.fallback(specialist, "Run deadline exceeded", started);
        }

        final Duration timeout = remaining.compareTo(modelConfig.getRequestTimeout()) < 0
                ? remaining
                : modelConfig.getRequestTimeout();

        final GenerationOptions options = new GenerationOptions(
                modelConfig.getModel(),
                modelConfig.getMaxTokens(),
                modelConfig.getTemperature(),
                timeout);

        final SpecialistResponse response = exceptionMapping.map(
                        Try.of(() -> promptBuilder.buildPrompt(specialist, proposal, context))
                                .map(prompt -> llmClient.call(prompt, options))
                                .map(answer -> responseParser.parse(modelConfig.getModel(), answer)))
                .recover(ex -> SpecialistResponse.fallback(exceptionHandler.getExceptionMessage(ex)))
                .get();

        final EvaluationRecord record = evaluationRepair.toRecord(specialist, response, started);

        if (record.isFallback()) {
            logger.warning("Specialist " + specialist.id() + " fell back to a neutral evaluation: "
                    + record.failureReason());
        } else {
            logger.fine("Specialist " + specialist.id() + " scored " + record.score()
                    + " (" + record.kind() + ") in " + record.processingTimeMs() + "ms");
        }

        return record;
    }
}
