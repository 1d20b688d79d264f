package ideavalidator.domain.evaluation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IndustryContextTest {

    @Test
    void testFoodDelivery() {
        assertEquals("Food & Delivery", IndustryContext.detect("TiffinBox", "Healthy lunch delivery for offices"));
    }

    @Test
    void testFirstMatchingIndustryWins() {
        // "delivery" and "app" both match, food is checked first
        assertEquals("Food & Delivery", IndustryContext.detect("QuickBite", "An app for meal delivery"));
    }

    @Test
    void testHealthcare() {
        assertEquals("Healthcare", IndustryContext.detect("ClinicLink", "Connects a patient with a doctor"));
    }

    @Test
    void testTechnology() {
        assertEquals("Technology", IndustryContext.detect("Ledgerly", "AI bookkeeping software"));
    }

    @Test
    void testWholeWordsOnly() {
        // "maintain" contains "ai" but is not a technology keyword
        assertEquals(IndustryContext.GENERAL_BUSINESS, IndustryContext.detect("GreenKeep", "We maintain gardens"));
    }

    @Test
    void testNullsAreGeneralBusiness() {
        assertEquals(IndustryContext.GENERAL_BUSINESS, IndustryContext.detect(null, null));
    }
}
