package ideavalidator.domain.sanitize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@SuppressWarnings("NullAway")
class GetFirstJsonObjectTest {

    private final GetFirstJsonObject getFirstJsonObject = new GetFirstJsonObject();

    @Test
    void testSanitizeWithNull() {
        assertNull(getFirstJsonObject.sanitize(null));
    }

    @Test
    void testSanitizeWithBlank() {
        assertNull(getFirstJsonObject.sanitize("  \n "));
    }

    @Test
    void testSanitizeWithNoObject() {
        assertNull(getFirstJsonObject.sanitize("The score is 75 out of 100."));
    }

    @Test
    void testSanitizeWithOnlyClosingBrace() {
        assertNull(getFirstJsonObject.sanitize("} nothing here {"));
    }

    @Test
    void testSanitizeWithPlainObject() {
        assertEquals("{\"score\": 80}", getFirstJsonObject.sanitize("{\"score\": 80}"));
    }

    @Test
    void testSanitizeWithSurroundingProse() {
        String document = "Sure! Here is the evaluation {\"score\": 80, \"strengths\": [\"a\"]} hope it helps";
        assertEquals("{\"score\": 80, \"strengths\": [\"a\"]}", getFirstJsonObject.sanitize(document));
    }

    @Test
    void testSanitizeWithNestedObjects() {
        String document = "{\"outer\": {\"inner\": 1}}";
        assertEquals(document, getFirstJsonObject.sanitize(document));
    }
}
