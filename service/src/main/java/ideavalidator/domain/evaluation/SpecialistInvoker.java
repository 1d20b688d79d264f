package ideavalidator.domain.evaluation;

import ideavalidator.domain.specialist.Specialist;

import java.time.Instant;

/**
 * Asks one specialist for its judgement of a proposal.
 */
public interface SpecialistInvoker {
    /**
     * Never throws for a failed or malformed call. Those produce a fallback record instead.
     *
     * @param specialist The specialist to consult
     * @param proposal   The idea being validated
     * @param context    The records of the specialist's resolved dependencies
     * @param deadline   The run deadline. A deadline in the past skips the call entirely.
     * @return The canonical record
     */
    EvaluationRecord invoke(Specialist specialist, Proposal proposal, DependencyContext context, Instant deadline);
}
