package org.ancombc.tools.biasmodel.math;

/**
 * Stores the summary of a scalar minimization job
 *
 * @author ancombc-bias-em developers
 */
public final class ScalarMinimizerSummary {

    public enum ScalarMinimizerStatus {
        /**
         * The minimizer met its convergence criterion
         */
        SUCCESS,

        /**
         * Too many function evaluations; the best point seen so far is reported
         */
        TOO_MANY_EVALUATIONS
    }

    public final double x;
    public final double value;
    public final int evaluations;
    public final ScalarMinimizerStatus status;

    public ScalarMinimizerSummary(final double x, final double value, final int evaluations,
                                  final ScalarMinimizerStatus status) {
        this.x = x;
        this.value = value;
        this.evaluations = evaluations;
        this.status = status;
    }

    public boolean isSuccessful() {
        return status == ScalarMinimizerStatus.SUCCESS;
    }

    @Override
    public String toString() {
        return String.format("ScalarMinimizerSummary{x=%.6e, value=%.6e, evaluations=%d, status=%s}",
                x, value, evaluations, status);
    }
}
