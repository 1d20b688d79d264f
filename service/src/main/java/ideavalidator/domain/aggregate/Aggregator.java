package ideavalidator.domain.aggregate;

/**
 * Reduces the records of a run to scores, an outcome and supporting analysis. Implementations must be
 * pure: the same records always give the same aggregation.
 */
public interface Aggregator {
    Aggregation aggregate(AggregationInput input);
}
