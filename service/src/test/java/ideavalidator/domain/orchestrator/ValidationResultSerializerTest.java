package ideavalidator.domain.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import ideavalidator.domain.aggregate.AggregationInput;
import ideavalidator.domain.aggregate.DefaultAggregator;
import ideavalidator.domain.evaluation.EvaluationRecord;
import ideavalidator.domain.evaluation.EvaluationRepair;
import ideavalidator.domain.evaluation.Proposal;
import ideavalidator.domain.evaluation.RawEvaluation;
import ideavalidator.domain.evaluation.SpecialistResponse;
import ideavalidator.domain.json.JsonDeserializer;
import ideavalidator.domain.json.JsonDeserializerJackson;
import ideavalidator.domain.logger.Loggers;
import ideavalidator.domain.specialist.Specialist;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SuppressWarnings("NullAway")
@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(ValidationResultSerializer.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(Loggers.class)
class ValidationResultSerializerTest {

    @Inject
    private ValidationResultSerializer serializer;

    @Inject
    private JsonDeserializer jsonDeserializer;

    private static ValidationResult result() {
        final Specialist specialist = new Specialist(
                "agent_001_originality", "Core Idea", "Novelty & Uniqueness", "Originality",
                40, List.of(), "Originality Analyst", "goal", "backstory");
        final EvaluationRecord record = new EvaluationRepair().toRecord(
                specialist,
                SpecialistResponse.parsed(new RawEvaluation(
                        72.0, 0.8, "Fresh take on lunch delivery.",
                        List.of("Offices want healthy food"), List.of("Unique menu"), List.of("Logistics"),
                        List.of("Run a pilot"), List.of(), List.of(), List.of("Dense office districts"))),
                Instant.now());
        final Proposal proposal = new Proposal("TiffinBox", "Healthy lunch delivery for offices");

        return ValidationResult.fromAggregation(
                "run-1",
                Instant.parse("2024-05-01T10:15:30Z"),
                proposal.name(),
                proposal.concept(),
                new DefaultAggregator().aggregate(new AggregationInput(proposal, List.of(record))),
                12);
    }

    @Test
    void testSnakeCaseKeys() {
        final JsonNode json = jsonDeserializer.readTree(serializer.toJson(result()));

        assertEquals("run-1", json.get("run_id").asText());
        assertEquals("TiffinBox", json.get("idea_name").asText());
        assertEquals(72.0, json.get("overall_score").asDouble(), 0.0001);
        assertEquals("Good", json.get("validation_outcome").asText());
        assertEquals(72.0, json.get("cluster_scores").get("Core Idea").asDouble(), 0.0001);
        assertEquals(1, json.get("total_specialists_consulted").asInt());
        assertEquals("2024-05-01T10:15:30Z", json.get("timestamp").asText());
        assertTrue(json.has("collaboration_insights"));
        assertTrue(json.has("maturity_estimate"));
    }

    @Test
    void testDetailedEvaluationsTree() {
        final JsonNode json = jsonDeserializer.readTree(serializer.toJson(result()));

        final JsonNode record = json.get("detailed_evaluations")
                .get("Core Idea")
                .get("Novelty & Uniqueness")
                .get("Originality");

        assertEquals("agent_001_originality", record.get("specialist_id").asText());
        assertEquals(72.0, record.get("score").asDouble(), 0.0001);
        assertEquals("Run a pilot", record.get("recommendations").get(0).asText());
        assertFalse(json.has("evaluation_tree"));
    }

    @Test
    void testMarketInsights() {
        final JsonNode json = jsonDeserializer.readTree(serializer.toJson(result()));

        assertEquals("Dense office districts", json.get("market_insights").get(0).asText());
    }

    @Test
    void testResultCannotBeModified() {
        final ValidationResult result = result();

        assertThrows(UnsupportedOperationException.class, () -> result.clusterScores().put("Injected", 1.0));
        assertThrows(UnsupportedOperationException.class, () -> result.evaluationTree().clear());
        assertThrows(UnsupportedOperationException.class, () -> result.evaluationTree().get("Core Idea").clear());
        assertThrows(UnsupportedOperationException.class,
                () -> result.evaluationTree().get("Core Idea").get("Novelty & Uniqueness").clear());
        assertThrows(UnsupportedOperationException.class, () -> result.clusterSummaries().clear());
        assertThrows(UnsupportedOperationException.class, () -> result.nextSteps().add(null));
        assertEquals(1, result.evaluationTree().size());
    }

    @Test
    void testNullErrorOmitted() {
        final JsonNode json = jsonDeserializer.readTree(serializer.toJson(result()));

        assertFalse(json.has("error_message"));
    }

    @Test
    void testFallbackCarriesError() {
        final ValidationResult fallback = ValidationResult.fallback(
                "run-2", Instant.now(), null, "concept", "name must not be blank", 3);

        final JsonNode json = jsonDeserializer.readTree(serializer.toPrettyJson(fallback));

        assertEquals("name must not be blank", json.get("error_message").asText());
        assertEquals("Moderate", json.get("validation_outcome").asText());
        assertEquals(50.0, json.get("overall_score").asDouble(), 0.0001);
    }
}
