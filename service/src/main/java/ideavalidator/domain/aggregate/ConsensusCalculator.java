package ideavalidator.domain.aggregate;

import java.util.List;

/**
 * Measures how closely specialists agree, as one minus the coefficient of variation of their scores.
 */
public final class ConsensusCalculator {
    private ConsensusCalculator() {
    }

    /**
     * @param scores The record scores, in a stable order
     * @return A value between 0 and 1, where 1 means every score was the same
     */
    public static double consensus(final List<Double> scores) {
        if (scores == null || scores.size() < 2) {
            return 1.0;
        }

        final double mean = scores.stream().mapToDouble(Double::doubleValue).sum() / scores.size();
        final double variance = scores.stream()
                .mapToDouble(score -> (score - mean) * (score - mean))
                .sum() / scores.size();
        final double deviation = Math.sqrt(variance);

        if (mean == 0) {
            return deviation == 0 ? 1.0 : 0.0;
        }

        return Math.max(0, Math.min(1, 1 - deviation / mean));
    }
}
