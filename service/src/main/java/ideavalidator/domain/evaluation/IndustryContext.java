package ideavalidator.domain.evaluation;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Map.entry;

/**
 * Guesses the industry of an idea from keywords in its name and concept.
 */
public final class IndustryContext {
    public static final String GENERAL_BUSINESS = "General Business";

    private static final Pattern WORD_SPLIT = Pattern.compile("[^a-z0-9]+");

    // Checked in order, the first industry with a matching keyword wins
    private static final List<Map.Entry<String, Set<String>>> INDUSTRIES = List.of(
            entry("Food & Delivery", Set.of("food", "delivery", "restaurant", "meal", "cooking", "nutrition",
                    "lunch", "breakfast", "dinner", "snacks")),
            entry("Healthcare", Set.of("health", "medical", "healthcare", "doctor", "patient", "medicine", "hospital")),
            entry("Education", Set.of("education", "learning", "school", "university", "course", "student",
                    "teach", "academic")),
            entry("Finance", Set.of("finance", "banking", "payment", "money", "investment", "fintech", "financial")),
            entry("E-commerce", Set.of("ecommerce", "retail", "shopping", "marketplace", "store", "buy", "sell")),
            entry("Manufacturing", Set.of("manufacturing", "production", "factory", "industrial", "manufacture")),
            entry("Technology", Set.of("tech", "software", "app", "platform", "digital", "ai", "technology")));

    private IndustryContext() {
    }

    public static String detect(final String name, final String concept) {
        final Set<String> words = WORD_SPLIT
                .splitAsStream((String.valueOf(name) + " " + String.valueOf(concept)).toLowerCase(Locale.ROOT))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toSet());

        return INDUSTRIES.stream()
                .filter(industry -> industry.getValue().stream().anyMatch(words::contains))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(GENERAL_BUSINESS);
    }
}
