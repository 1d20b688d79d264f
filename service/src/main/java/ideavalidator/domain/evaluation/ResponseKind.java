package ideavalidator.domain.evaluation;

/**
 * How a specialist's answer was obtained.
 */
public enum ResponseKind {
    /**
     * The model returned a JSON object that could be read directly.
     */
    PARSED,
    /**
     * The JSON was unreadable, but a score was salvaged from the text.
     */
    REPAIRED,
    /**
     * Nothing usable came back, so a neutral record was substituted.
     */
    FALLBACK
}
