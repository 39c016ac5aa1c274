package org.ancombc.tools.biasmodel.math;

import org.apache.commons.lang3.Validate;

/**
 * Stopping criteria of a scalar minimization.
 *
 * @author ancombc-bias-em developers
 */
public class ScalarMinimizerDescription {

    private final double absoluteAccuracy, relativeAccuracy;
    private final int maxEvaluations;

    public ScalarMinimizerDescription(final double absoluteAccuracy, final double relativeAccuracy,
                                      final int maxEvaluations) {
        Validate.isTrue(absoluteAccuracy > 0, "The absolute accuracy must be positive.");
        Validate.isTrue(relativeAccuracy > 0, "The relative accuracy must be positive.");
        Validate.isTrue(maxEvaluations > 0, "The maximum number of evaluations must be positive.");
        this.absoluteAccuracy = absoluteAccuracy;
        this.relativeAccuracy = relativeAccuracy;
        this.maxEvaluations = maxEvaluations;
    }

    public double getAbsoluteAccuracy() {
        return absoluteAccuracy;
    }

    public double getRelativeAccuracy() {
        return relativeAccuracy;
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }
}
