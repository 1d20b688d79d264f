package ideavalidator.domain.orchestrator;

import com.google.common.util.concurrent.Uninterruptibles;
import ideavalidator.domain.aggregate.DefaultAggregator;
import ideavalidator.domain.aggregate.ValidationOutcome;
import ideavalidator.domain.answer.AnswerFormatterDeepseek;
import ideavalidator.domain.answer.AnswerFormatterQwen;
import ideavalidator.domain.answer.DefaultAnswerFormatterService;
import ideavalidator.domain.config.ModelConfig;
import ideavalidator.domain.evaluation.EvaluationRecord;
import ideavalidator.domain.evaluation.EvaluationRepair;
import ideavalidator.domain.evaluation.EvaluationResponseParser;
import ideavalidator.domain.evaluation.LlmSpecialistInvoker;
import ideavalidator.domain.evaluation.SpecialistPromptBuilder;
import ideavalidator.domain.exceptionhandling.LoggingExceptionHandler;
import ideavalidator.domain.exceptionhandling.StandardExceptionMapping;
import ideavalidator.domain.exceptions.FailedOllama;
import ideavalidator.domain.json.JsonDeserializerJackson;
import ideavalidator.domain.logger.Loggers;
import ideavalidator.domain.planner.TopologicalDependencyPlanner;
import ideavalidator.domain.planner.ValidationPlanProducer;
import ideavalidator.domain.prompt.PromptBuilderLlama3;
import ideavalidator.domain.prompt.PromptBuilderPlain;
import ideavalidator.domain.prompt.PromptBuilderQwen;
import ideavalidator.domain.prompt.PromptBuilderSelector;
import ideavalidator.domain.sanitize.GetFirstJsonObject;
import ideavalidator.domain.sanitize.GetFirstMarkdownBlock;
import ideavalidator.domain.specialist.FrameworkInfo;
import ideavalidator.domain.specialist.Specialist;
import ideavalidator.domain.specialist.SpecialistRegistry;
import ideavalidator.domain.specialist.SpecialistRegistryProducer;
import ideavalidator.domain.timeout.CompletableFutureTimeoutService;
import ideavalidator.infrastructure.mock.MockLlmClient;
import ideavalidator.infrastructure.mock.PreferredMockLlmClientProducer;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SuppressWarnings("NullAway")
@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(WaveValidationOrchestrator.class)
@AddBeanClasses(ValidationConfig.class)
@AddBeanClasses(ValidationPlanProducer.class)
@AddBeanClasses(TopologicalDependencyPlanner.class)
@AddBeanClasses(SpecialistRegistryProducer.class)
@AddBeanClasses(LlmSpecialistInvoker.class)
@AddBeanClasses(SpecialistPromptBuilder.class)
@AddBeanClasses(EvaluationResponseParser.class)
@AddBeanClasses(EvaluationRepair.class)
@AddBeanClasses(DefaultAggregator.class)
@AddBeanClasses(CompletableFutureTimeoutService.class)
@AddBeanClasses(ModelConfig.class)
@AddBeanClasses(PromptBuilderSelector.class)
@AddBeanClasses(PromptBuilderPlain.class)
@AddBeanClasses(PromptBuilderLlama3.class)
@AddBeanClasses(PromptBuilderQwen.class)
@AddBeanClasses(DefaultAnswerFormatterService.class)
@AddBeanClasses(AnswerFormatterDeepseek.class)
@AddBeanClasses(AnswerFormatterQwen.class)
@AddBeanClasses(GetFirstMarkdownBlock.class)
@AddBeanClasses(GetFirstJsonObject.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(StandardExceptionMapping.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
@AddBeanClasses(MockLlmClient.class)
@AddBeanClasses(PreferredMockLlmClientProducer.class)
class WaveValidationOrchestratorTest {

    private static final int SPECIALIST_LIMIT = 10;

    private static final String RESPONSE = """
            {"score": 75, "confidence_level": 0.8, "explanation": "Solid idea.",
             "strengths": ["Clear need"], "weaknesses": ["Crowded market"],
             "key_insights": ["Offices value convenience"], "recommendations": ["Run a pilot"],
             "risk_factors": ["Food safety"]}
            """;

    @Inject
    private WaveValidationOrchestrator orchestrator;

    @Inject
    private SpecialistRegistry registry;

    @Inject
    private MockLlmClient mockLlmClient;

    /**
     * The plan is built when the container starts, so the config has to be in place before then.
     */
    @BeforeAll
    static void updateConfig() {
        registerConfig(Map.of(
                "iv.specialists.limit", String.valueOf(SPECIALIST_LIMIT),
                "iv.validation.poolsize", "4",
                "iv.llm.timeoutseconds", "5"));
    }

    @AfterAll
    static void restoreConfig() {
        registerConfig(Map.of());
    }

    private static void registerConfig(final Map<String, String> properties) {
        final var configSource = new PropertiesConfigSource(
                properties,
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @BeforeEach
    void resetMock() {
        mockLlmClient.reset();
    }

    @Test
    void testAllSpecialistsConsulted() {
        mockLlmClient.setMockResponse(RESPONSE);

        final ValidationResult result = orchestrator.validateIdea(
                "TiffinBox", "Healthy lunch delivery for offices", Map.of(), Duration.ofMinutes(1));

        assertNull(result.errorMessage());
        assertEquals(SPECIALIST_LIMIT, result.totalSpecialistsConsulted());
        assertEquals(SPECIALIST_LIMIT, mockLlmClient.getCallCount());
        assertEquals(0, result.fallbackCount());
        assertEquals(75.0, result.overallScore(), 0.0001);
        assertEquals(ValidationOutcome.GOOD, result.validationOutcome());
        assertEquals(1.0, result.consensusLevel(), 0.0001);
        assertTrue(result.weakAreas().isEmpty());
        assertEquals("Run a pilot", result.keyRecommendations().get(0));
        assertEquals("TiffinBox", result.ideaName());
    }

    @Test
    void testClusterScoresMatchDispatchedClusters() {
        mockLlmClient.setMockResponse(RESPONSE);

        final ValidationResult result = orchestrator.validateIdea(
                "TiffinBox", "Healthy lunch delivery for offices", null, Duration.ofMinutes(1));

        final Set<String> dispatched = registry.allSpecialists().stream()
                .map(Specialist::cluster)
                .collect(Collectors.toSet());

        assertEquals(dispatched, result.clusterScores().keySet());
        assertEquals(dispatched, result.evaluationTree().keySet());
    }

    @Test
    void testFailingSpecialistFallsBack() {
        mockLlmClient.setResponder(prompt -> {
            if (prompt.contains("VALIDATION TASK: Originality Assessment")) {
                throw new FailedOllama("model crashed");
            }
            return RESPONSE;
        });

        final ValidationResult result = orchestrator.validateIdea(
                "TiffinBox", "Healthy lunch delivery for offices", null, Duration.ofMinutes(1));

        assertNull(result.errorMessage());
        assertEquals(SPECIALIST_LIMIT, result.totalSpecialistsConsulted());
        assertEquals(1, result.fallbackCount());

        final EvaluationRecord originality = result.evaluationTree().values().stream()
                .flatMap(parameters -> parameters.values().stream())
                .flatMap(subParameters -> subParameters.values().stream())
                .filter(record -> record.specialistId().equals("agent_001_originality"))
                .findFirst()
                .orElseThrow();

        assertTrue(originality.isFallback());
        assertEquals(EvaluationRepair.FALLBACK_SCORE, originality.score());
        assertTrue(result.collaborationInsights().contains("1 specialist evaluations used fallback results"));
    }

    @Test
    void testSlowSpecialistCutOffAtRunDeadline() {
        mockLlmClient.setResponder(prompt -> {
            if (prompt.contains("VALIDATION TASK: Originality Assessment")) {
                Uninterruptibles.sleepUninterruptibly(4, TimeUnit.SECONDS);
            }
            return RESPONSE;
        });

        final ValidationResult result = orchestrator.validateIdea(
                "TiffinBox", "Healthy lunch delivery for offices", null, Duration.ofMillis(1500));

        assertNull(result.errorMessage());
        assertEquals(SPECIALIST_LIMIT, result.totalSpecialistsConsulted());
        assertTrue(result.fallbackCount() >= 1);
        assertTrue(result.fallbackCount() < SPECIALIST_LIMIT);
        assertTrue(result.processingTimeMs() < 4_000);

        final EvaluationRecord originality = result.evaluationTree().values().stream()
                .flatMap(parameters -> parameters.values().stream())
                .flatMap(subParameters -> subParameters.values().stream())
                .filter(record -> record.specialistId().equals("agent_001_originality"))
                .findFirst()
                .orElseThrow();

        assertTrue(originality.isFallback());
        assertEquals(WaveValidationOrchestrator.DEADLINE_EXCEEDED, originality.failureReason());
    }

    @Test
    void testInterruptedRunReturnsFallbackResult() {
        mockLlmClient.setMockResponse(RESPONSE);

        Thread.currentThread().interrupt();
        final ValidationResult result = orchestrator.validateIdea(
                "TiffinBox", "Healthy lunch delivery for offices", null, Duration.ofMinutes(1));

        // Clears the flag again so later tests are unaffected
        assertTrue(Thread.interrupted());
        assertTrue(result.isFallback());
        assertEquals(WaveValidationOrchestrator.INTERRUPTED, result.errorMessage());
        assertEquals(ValidationResult.FALLBACK_SCORE, result.overallScore());
    }

    @Test
    void testBlankIdeaReturnsFallbackResult() {
        mockLlmClient.setMockResponse(RESPONSE);

        final ValidationResult result = orchestrator.validateIdea("  ", "Healthy lunch delivery", null, null);

        assertTrue(result.isFallback());
        assertNotNull(result.errorMessage());
        assertEquals(ValidationResult.FALLBACK_SCORE, result.overallScore());
        assertEquals(ValidationOutcome.MODERATE, result.validationOutcome());
        assertTrue(result.clusterScores().isEmpty());
        assertTrue(result.overallSummary().startsWith("Validation could not be completed"));
        assertEquals(0, mockLlmClient.getCallCount());
    }

    @Test
    void testExpiredDeadlineFallsBackEverywhere() {
        mockLlmClient.setMockResponse(RESPONSE);

        final ValidationResult result = orchestrator.validateIdea(
                "TiffinBox", "Healthy lunch delivery for offices", null, Duration.ZERO);

        assertNull(result.errorMessage());
        assertEquals(SPECIALIST_LIMIT, result.totalSpecialistsConsulted());
        assertEquals(SPECIALIST_LIMIT, result.fallbackCount());
        assertEquals(EvaluationRepair.FALLBACK_SCORE, result.overallScore(), 0.0001);
        assertEquals(0, mockLlmClient.getCallCount());
    }

    @Test
    void testRunsAreIndependent() {
        mockLlmClient.setMockResponse(RESPONSE);

        final ValidationResult first = orchestrator.validateIdea(
                "TiffinBox", "Healthy lunch delivery for offices", null, Duration.ofMinutes(1));
        final ValidationResult second = orchestrator.validateIdea(
                "TiffinBox", "Healthy lunch delivery for offices", null, Duration.ofMinutes(1));

        assertFalse(first.runId().equals(second.runId()));
        assertEquals(first.clusterScores(), second.clusterScores());
        assertEquals(2 * SPECIALIST_LIMIT, mockLlmClient.getCallCount());
    }

    @Test
    void testFrameworkInfo() {
        final FrameworkInfo info = orchestrator.frameworkInfo();

        assertEquals(SPECIALIST_LIMIT, info.totalSpecialists());
        assertEquals(info.totalSpecialists(),
                info.specialistsPerCluster().values().stream().mapToInt(Integer::intValue).sum());
    }
}
