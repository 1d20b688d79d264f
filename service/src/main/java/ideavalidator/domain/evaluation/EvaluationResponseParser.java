package ideavalidator.domain.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import ideavalidator.domain.answer.AnswerFormatterService;
import ideavalidator.domain.json.JsonDeserializer;
import ideavalidator.domain.sanitize.SanitizeDocument;
import io.smallrye.common.annotation.Identifier;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads a raw model answer into a tagged response. JSON is preferred, then a score salvaged from
 * the text, and otherwise a fallback.
 */
@ApplicationScoped
public class EvaluationResponseParser {
    private static final Pattern SCORE_PATTERN =
            Pattern.compile("score[\"':\\s]*([0-9]+(?:\\.[0-9]+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final int SALVAGED_SENTENCES = 3;
    private static final int SALVAGED_EXPLANATION_LENGTH = 200;
    private static final double SALVAGED_CONFIDENCE = 0.6;

    @Inject
    private AnswerFormatterService answerFormatterService;

    @Inject
    @Identifier("findFirstMarkdownBlock")
    private SanitizeDocument findFirstMarkdownBlock;

    @Inject
    @Identifier("findFirstJsonObject")
    private SanitizeDocument findFirstJsonObject;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private Logger logger;

    public SpecialistResponse parse(final String model, @Nullable final String response) {
        if (StringUtils.isBlank(response)) {
            return SpecialistResponse.fallback("The model returned an empty response");
        }

        final String answer = answerFormatterService.formatResponse(model, response);
        final String json = findFirstJsonObject.sanitize(findFirstMarkdownBlock.sanitize(answer));

        return Try.of(() -> jsonDeserializer.readTree(json))
                .filter(JsonNode::isObject)
                .map(this::fromJson)
                .map(SpecialistResponse::parsed)
                .onFailure(ex -> logger.fine("Response was not a JSON object, trying to salvage a score: " + ex))
                .getOrElseGet(ex -> salvage(answer));
    }

    private SpecialistResponse salvage(final String text) {
        final Matcher matcher = SCORE_PATTERN.matcher(text);
        if (!matcher.find() || !NumberUtils.isCreatable(matcher.group(1))) {
            return SpecialistResponse.fallback("No score could be found in the response");
        }

        final String sentences = SENTENCE_END.splitAsStream(text.trim())
                .limit(SALVAGED_SENTENCES)
                .collect(Collectors.joining(" "));

        return SpecialistResponse.repaired(RawEvaluation.salvaged(
                NumberUtils.toDouble(matcher.group(1)),
                SALVAGED_CONFIDENCE,
                StringUtils.abbreviate(sentences, SALVAGED_EXPLANATION_LENGTH),
                List.of("Extracted from text analysis")));
    }

    private RawEvaluation fromJson(final JsonNode node) {
        return new RawEvaluation(
                number(node.get("score")),
                number(node.has("confidence_level") ? node.get("confidence_level") : node.get("confidence")),
                text(node.get("explanation")),
                list(node.get("key_insights")),
                list(node.get("strengths")),
                list(node.get("weaknesses")),
                list(node.get("recommendations")),
                list(node.get("risk_factors")),
                list(node.get("assumptions")),
                list(node.get("market_considerations")));
    }

    @Nullable
    private Double number(@Nullable final JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }

        if (node.isNumber()) {
            return node.asDouble();
        }

        // Models sometimes quote numbers or add a suffix, like "75/100" or "80%"
        final String value = StringUtils.substringBefore(node.asText().trim(), "/").replace("%", "").trim();
        return NumberUtils.isCreatable(value) ? NumberUtils.toDouble(value) : null;
    }

    @Nullable
    private String text(@Nullable final JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }

        if (node.isArray()) {
            return list(node).stream()
                    .map(entry -> StringUtils.removeEnd(entry, "."))
                    .collect(Collectors.joining(". "));
        }

        return node.asText();
    }

    private List<String> list(@Nullable final JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }

        if (node.isTextual()) {
            return List.of(node.asText());
        }

        final List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.isValueNode() ? item.asText() : item.toString()));
        }
        return values;
    }
}
