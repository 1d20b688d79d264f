package ideavalidator.domain.prompt;

import jakarta.inject.Inject;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddBeanClasses(PromptBuilderSelector.class)
@AddBeanClasses(PromptBuilderPlain.class)
@AddBeanClasses(PromptBuilderLlama3.class)
@AddBeanClasses(PromptBuilderQwen.class)
class PromptBuilderSelectorTest {

    @Inject
    private PromptBuilderSelector promptBuilderSelector;

    @Test
    void testLlama3Selected() {
        assertInstanceOf(PromptBuilderLlama3.class, promptBuilderSelector.getPromptBuilder("llama3.2"));
    }

    @Test
    void testQwenSelected() {
        assertInstanceOf(PromptBuilderQwen.class, promptBuilderSelector.getPromptBuilder("qwen2.5:7b"));
    }

    @Test
    void testUnknownModelUsesPlain() {
        assertInstanceOf(PromptBuilderPlain.class, promptBuilderSelector.getPromptBuilder("mistral"));
    }

    @Test
    void testLlama3FinalPrompt() {
        final PromptBuilder builder = promptBuilderSelector.getPromptBuilder("llama3.1");
        final String context = builder.buildContextPrompt("Idea Details", "- Name: Tiffin");
        final String prompt = builder.buildFinalPrompt("You are an analyst.", context, "Score the idea");

        assertTrue(prompt.startsWith("<|begin_of_text|>"));
        assertTrue(prompt.contains("Idea Details:\n- Name: Tiffin"));
        assertTrue(prompt.endsWith("<|start_header_id|>assistant<|end_header_id|>"));
    }

    @Test
    void testPlainBlankContextIsEmpty() {
        assertTrue(new PromptBuilderPlain().buildContextPrompt("Title", " ").isEmpty());
    }
}
