package ideavalidator.domain.evaluation;

import ideavalidator.domain.config.ModelConfig;
import ideavalidator.domain.prompt.PromptBuilder;
import ideavalidator.domain.prompt.PromptBuilderSelector;
import ideavalidator.domain.specialist.Specialist;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Builds the prompt sent to the model for one specialist, formatted for the configured model.
 */
@ApplicationScoped
public class SpecialistPromptBuilder {
    private static final String OUTPUT_FORMAT = """
            REQUIRED OUTPUT FORMAT:
            Respond with a single JSON object with exactly these fields:
            - score: number between 0 and 100
            - confidence_level: number between 0.0 and 1.0
            - explanation: detailed analysis of 25 to 75 words
            - key_insights: array of 2 to 3 one line insights
            - strengths: array of at least 2 specific strengths
            - weaknesses: array of at least 2 specific weaknesses
            - recommendations: array of exactly 3 actionable items
            - risk_factors: array of risks
            - assumptions: array of assumptions made
            - market_considerations: one sentence about the target market
            """;

    private static final String RUBRIC = """
            SCORING RUBRIC:
            - 90-100: Outstanding - exceeds expectations significantly
            - 80-89: Strong - above market standards
            - 70-79: Good - meets expectations well
            - 60-69: Acceptable - meets basic requirements
            - 50-59: Below expectations - needs improvement
            - 40-49: Weak - major improvements required
            - 30-39: Poor - fundamental problems
            - 0-29: Critical - not viable
            """;

    @Inject
    private PromptBuilderSelector promptBuilderSelector;

    @Inject
    private ModelConfig modelConfig;

    public String buildPrompt(final Specialist specialist, final Proposal proposal, final DependencyContext context) {
        checkNotNull(specialist);
        checkNotNull(proposal);

        final PromptBuilder promptBuilder = promptBuilderSelector.getPromptBuilder(modelConfig.getModel());

        final String instructions = "You are a " + specialist.role() + ".\n"
                + specialist.goal() + "\n"
                + specialist.backstory();

        final String ideaContext = promptBuilder.buildContextPrompt("Idea Details",
                "- Name: " + proposal.name() + "\n"
                        + "- Concept: " + proposal.concept() + "\n"
                        + "- Industry Context: " + IndustryContext.detect(proposal.name(), proposal.concept()));

        final String dependencyContext = context == null || context.isEmpty()
                ? ""
                : "\n" + promptBuilder.buildContextPrompt("Related Specialist Findings", context.summary());

        final String prompt = "VALIDATION TASK: " + specialist.subParameter() + " Assessment\n\n"
                + "You are evaluating " + specialist.subParameter() + " within the " + specialist.parameter()
                + " parameter of the " + specialist.cluster() + " cluster.\n"
                + "Weight in overall assessment: " + specialist.weight() + "\n\n"
                + OUTPUT_FORMAT + "\n"
                + RUBRIC + "\n"
                + "Every list must be populated with specific content. Respond with JSON only.";

        return promptBuilder.buildFinalPrompt(instructions, ideaContext + dependencyContext, prompt);
    }
}
