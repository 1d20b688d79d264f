package ideavalidator.domain.aggregate;

import ideavalidator.domain.evaluation.EvaluationRecord;
import ideavalidator.domain.evaluation.Proposal;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Everything the aggregator needs from a finished run. The records may be in any order.
 */
public record AggregationInput(Proposal proposal, List<EvaluationRecord> records) {
    public AggregationInput {
        checkNotNull(proposal);
        records = records == null ? List.of() : List.copyOf(records);
    }
}
