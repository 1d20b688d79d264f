package ideavalidator.domain.evaluation;

import org.jspecify.annotations.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The outcome of reading a model answer. Parsed and repaired responses carry an evaluation,
 * fallback responses carry the reason nothing usable was returned.
 */
public record SpecialistResponse(ResponseKind kind,
                                 @Nullable RawEvaluation evaluation,
                                 @Nullable String failureReason) {
    public SpecialistResponse {
        checkNotNull(kind);
        checkArgument(kind == ResponseKind.FALLBACK || evaluation != null,
                "parsed and repaired responses must carry an evaluation");
    }

    public static SpecialistResponse parsed(final RawEvaluation evaluation) {
        return new SpecialistResponse(ResponseKind.PARSED, evaluation, null);
    }

    public static SpecialistResponse repaired(final RawEvaluation evaluation) {
        return new SpecialistResponse(ResponseKind.REPAIRED, evaluation, null);
    }

    public static SpecialistResponse fallback(final String failureReason) {
        return new SpecialistResponse(ResponseKind.FALLBACK, null, failureReason);
    }
}
