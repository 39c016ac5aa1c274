package org.ancombc.tools.biasmodel.math;

import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * Wraps an objective and remembers the lowest finite value it has returned. Not thread-safe; one instance
 * per minimization job.
 *
 * @author ancombc-bias-em developers
 */
final class BestPointTracker implements UnivariateFunction {

    private final UnivariateFunction objective;
    private double bestPoint = Double.NaN;
    private double bestValue = Double.POSITIVE_INFINITY;

    BestPointTracker(final UnivariateFunction objective) {
        this.objective = objective;
    }

    @Override
    public double value(final double x) {
        final double value = objective.value(x);
        if (value < bestValue || Double.isNaN(bestPoint)) {
            bestPoint = x;
            bestValue = value;
        }
        return value;
    }

    boolean hasBestPoint() {
        return !Double.isNaN(bestPoint);
    }

    double getBestPoint() {
        return bestPoint;
    }

    double getBestValue() {
        return bestValue;
    }
}
