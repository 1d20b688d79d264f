package ideavalidator.domain.orchestrator;

import ideavalidator.domain.aggregate.Aggregation;
import ideavalidator.domain.aggregate.AggregationInput;
import ideavalidator.domain.aggregate.Aggregator;
import ideavalidator.domain.evaluation.DependencyContext;
import ideavalidator.domain.evaluation.EvaluationRecord;
import ideavalidator.domain.evaluation.EvaluationRepair;
import ideavalidator.domain.evaluation.Proposal;
import ideavalidator.domain.evaluation.SpecialistInvoker;
import ideavalidator.domain.exceptionhandling.ExceptionHandler;
import ideavalidator.domain.exceptions.InternalFailure;
import ideavalidator.domain.planner.ExecutionPlan;
import ideavalidator.domain.planner.ValidationPlanProducer;
import ideavalidator.domain.planner.Wave;
import ideavalidator.domain.specialist.FrameworkInfo;
import ideavalidator.domain.specialist.Specialist;
import ideavalidator.domain.specialist.SpecialistRegistry;
import ideavalidator.domain.timeout.TimeoutService;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * Runs the planned waves one after another. The members of a wave run concurrently on a pool that
 * lives for a single run, and a wave that outlives the run deadline has its stragglers replaced by
 * fallback records.
 */
@ApplicationScoped
public class WaveValidationOrchestrator implements ValidationOrchestrator {
    static final String DEADLINE_EXCEEDED = "Run deadline exceeded";
    static final String INTERRUPTED = "Validation run was interrupted";

    @Inject
    private ValidationPlanProducer planProducer;

    @Inject
    private SpecialistRegistry registry;

    @Inject
    private SpecialistInvoker invoker;

    @Inject
    private EvaluationRepair evaluationRepair;

    @Inject
    private Aggregator aggregator;

    @Inject
    private TimeoutService timeoutService;

    @Inject
    private ValidationConfig validationConfig;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @Override
    public ValidationResult validateIdea(@Nullable final String name,
                                         @Nullable final String concept,
                                         @Nullable final Map<String, Double> weights,
                                         @Nullable final Duration deadline) {
        final String runId = UUID.randomUUID().toString();
        final Instant started = Instant.now();

        return Try.of(() -> new Proposal(name, concept, weights))
                .map(proposal -> run(runId, started, proposal, deadline))
                .onFailure(ex -> logger.severe("Validation run " + runId + " failed: "
                        + exceptionHandler.getExceptionMessage(ex)))
                .recover(ex -> ValidationResult.fallback(
                        runId,
                        started,
                        name,
                        concept,
                        exceptionHandler.getExceptionMessage(ex),
                        elapsed(started)))
                .get();
    }

    @Override
    public FrameworkInfo frameworkInfo() {
        return registry.frameworkInfo();
    }

    private ValidationResult run(final String runId,
                                 final Instant started,
                                 final Proposal proposal,
                                 @Nullable final Duration deadline) {
        final Instant runDeadline = started.plus(Objects.requireNonNullElse(deadline, validationConfig.getDefaultDeadline()));
        final ExecutionPlan plan = planProducer.getPlan();

        logger.info("Starting validation run " + runId + " for \"" + proposal.name() + "\" with "
                + plan.specialistCount() + " specialists in " + plan.waves().size() + " waves");

        final Map<String, EvaluationRecord> completed = new ConcurrentHashMap<>();
        final ExecutorService pool = Executors.newFixedThreadPool(validationConfig.getPoolSize());
        try {
            for (final Wave wave : plan.waves()) {
                completed.putAll(runWave(wave, plan, proposal, runDeadline, pool, completed));

                // The interrupt flag stays set so the caller can still see it
                if (Thread.currentThread().isInterrupted()) {
                    throw new InternalFailure(INTERRUPTED);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        final Aggregation aggregation = aggregator.aggregate(
                new AggregationInput(proposal, new ArrayList<>(completed.values())));

        final ValidationResult result = ValidationResult.fromAggregation(
                runId,
                started,
                proposal.name(),
                proposal.concept(),
                aggregation,
                elapsed(started));

        logger.info("Finished validation run " + runId + " in " + result.processingTimeMs() + "ms with score "
                + String.format(Locale.ROOT, "%.2f", result.overallScore()) + " (" + result.validationOutcome().getLabel()
                + ") and " + result.fallbackCount() + " fallbacks");

        return result;
    }

    private Map<String, EvaluationRecord> runWave(final Wave wave,
                                                  final ExecutionPlan plan,
                                                  final Proposal proposal,
                                                  final Instant runDeadline,
                                                  final ExecutorService pool,
                                                  final Map<String, EvaluationRecord> completed) {
        final Instant waveStarted = Instant.now();
        final Map<Specialist, CompletableFuture<EvaluationRecord>> futures = new LinkedHashMap<>();

        for (final Specialist specialist : wave.specialists()) {
            final DependencyContext context = dependencyContext(plan, specialist, completed);
            futures.put(specialist, CompletableFuture.supplyAsync(
                    () -> invokeSafely(specialist, proposal, context, runDeadline), pool));
        }

        final Duration remaining = Duration.between(Instant.now(), runDeadline);
        final boolean finished = timeoutService.executeWithTimeout(
                CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).thenApply(ignored -> true),
                () -> false,
                remaining.isNegative() ? Duration.ZERO : remaining);

        if (!finished) {
            logger.warning("Wave " + wave.index() + " did not finish before the run deadline");
        }

        final Map<String, EvaluationRecord> records = new LinkedHashMap<>();
        futures.forEach((specialist, future) -> {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                records.put(specialist.id(), future.join());
            } else {
                future.cancel(true);
                records.put(specialist.id(), evaluationRepair.fallback(specialist, DEADLINE_EXCEEDED, waveStarted));
            }
        });

        logger.fine("Wave " + wave.index() + " resolved " + records.size() + " specialists");

        return records;
    }

    /**
     * The invoker already turns call failures into fallbacks, this also covers anything unexpected so
     * a wave's futures only ever complete normally.
     */
    private EvaluationRecord invokeSafely(final Specialist specialist,
                                          final Proposal proposal,
                                          final DependencyContext context,
                                          final Instant runDeadline) {
        return Try.of(() -> invoker.invoke(specialist, proposal, context, runDeadline))
                .getOrElseGet(ex -> evaluationRepair.fallback(
                        specialist, exceptionHandler.getExceptionMessage(ex), Instant.now()));
    }

    private DependencyContext dependencyContext(final ExecutionPlan plan,
                                                final Specialist specialist,
                                                final Map<String, EvaluationRecord> completed) {
        final Map<String, List<EvaluationRecord>> records = new LinkedHashMap<>();
        plan.dependenciesOf(specialist.id()).forEach((name, owners) -> records.put(name, owners.stream()
                .map(owner -> completed.get(owner.id()))
                .filter(Objects::nonNull)
                .toList()));

        return new DependencyContext(records);
    }

    private static long elapsed(final Instant started) {
        return Math.max(0, Duration.between(started, Instant.now()).toMillis());
    }
}
