package ideavalidator.domain.answer;

/**
 * Applies the answer formatter that matches a model, if any.
 */
public interface AnswerFormatterService {
    String formatResponse(String model, String response);
}
