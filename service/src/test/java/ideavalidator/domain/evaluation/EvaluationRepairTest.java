package ideavalidator.domain.evaluation;

import ideavalidator.domain.specialist.Specialist;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvaluationRepairTest {

    private static final Specialist SPECIALIST = new Specialist("agent_001_originality", "Core Idea",
            "Novelty & Uniqueness", "Originality", 30, List.of("Innovation Index"), "role", "goal", "backstory");

    private final EvaluationRepair repair = new EvaluationRepair();

    @Test
    void testNormalizeScore() {
        assertEquals(60, EvaluationRepair.normalizeScore(null));
        assertEquals(60, EvaluationRepair.normalizeScore(Double.NaN));
        assertEquals(80, EvaluationRepair.normalizeScore(4.0));
        assertEquals(100, EvaluationRepair.normalizeScore(5.0));
        assertEquals(72.5, EvaluationRepair.normalizeScore(72.5));
        assertEquals(100, EvaluationRepair.normalizeScore(140.0));
        assertEquals(0, EvaluationRepair.normalizeScore(-3.0));
    }

    @Test
    void testNormalizeConfidence() {
        assertEquals(0.7, EvaluationRepair.normalizeConfidence(null));
        assertEquals(1.0, EvaluationRepair.normalizeConfidence(85.0));
        assertEquals(0.0, EvaluationRepair.normalizeConfidence(-0.2));
        assertEquals(0.65, EvaluationRepair.normalizeConfidence(0.65));
    }

    @Test
    void testNormalizeExplanation() {
        assertEquals("Analysis completed", EvaluationRepair.normalizeExplanation(null));
        assertEquals("Analysis completed", EvaluationRepair.normalizeExplanation("   "));
        assertEquals("Short and clear.", EvaluationRepair.normalizeExplanation(" Short and clear. "));

        final String longText = String.join(" ", Collections.nCopies(60, "word"));
        final String truncated = EvaluationRepair.normalizeExplanation(longText);
        assertTrue(truncated.endsWith("..."));
        assertEquals(50, truncated.substring(0, truncated.length() - 3).split(" ").length);
    }

    @Test
    void testEmptyListsGetPlaceholders() {
        final RawEvaluation raw = new RawEvaluation(75.0, 0.8, "Good", List.of(), List.of(" ", ""), null,
                List.of(), List.of(), List.of(), List.of());

        final EvaluationRecord record = repair.toRecord(SPECIALIST, SpecialistResponse.parsed(raw), Instant.now());

        assertEquals(Placeholders.strengths("Originality"), record.strengths());
        assertEquals(Placeholders.weaknesses("Originality"), record.weaknesses());
        assertEquals(Placeholders.keyInsights("Originality"), record.keyInsights());
        assertEquals(Placeholders.recommendations("Originality"), record.recommendations());
        assertTrue(record.riskFactors().isEmpty());
        assertEquals(ResponseKind.PARSED, record.kind());
    }

    @Test
    void testProvidedListsKept() {
        final RawEvaluation raw = new RawEvaluation(75.0, 0.8, "Good", List.of("Insight"), List.of(" Strong brand "),
                List.of("Thin moat"), List.of("Patent it"), List.of("Copycats"), List.of("Stable demand"),
                List.of(" Office parks in tier 1 cities ", ""));

        final EvaluationRecord record = repair.toRecord(SPECIALIST, SpecialistResponse.repaired(raw), Instant.now());

        assertEquals(List.of("Strong brand"), record.strengths());
        assertEquals(List.of("Thin moat"), record.weaknesses());
        assertEquals(List.of("Insight"), record.keyInsights());
        assertEquals(List.of("Patent it"), record.recommendations());
        assertEquals(List.of("Copycats"), record.riskFactors());
        assertEquals(List.of("Office parks in tier 1 cities"), record.marketConsiderations());
        assertEquals(ResponseKind.REPAIRED, record.kind());
    }

    @Test
    void testFallbackRecord() {
        final EvaluationRecord record = repair.toRecord(SPECIALIST,
                SpecialistResponse.fallback("connection refused"), Instant.now());

        assertEquals(50, record.score());
        assertEquals(0.5, record.confidence());
        assertEquals("Fallback evaluation for Originality due to processing error", record.explanation());
        assertEquals(List.of("Fallback evaluation applied"), record.assumptions());
        assertEquals(List.of("Evaluation uncertainty for Originality"), record.riskFactors());
        assertEquals("connection refused", record.failureReason());
        assertTrue(record.isFallback());
        assertEquals(List.of("Innovation Index"), record.dependencies());
    }
}
