package org.ancombc.tools.biasmodel.math;

import org.apache.commons.math3.analysis.UnivariateFunction;

import javax.annotation.Nonnull;

/**
 * Minimizes a scalar objective over the half-line [lower, infinity).
 *
 * Implementations must be deterministic for a fixed objective, bound and starting point, must never return
 * a point below the bound, and must converge to a local minimum within their evaluation budget. Running out
 * of budget is reported through {@link ScalarMinimizerSummary#status} rather than thrown.
 *
 * Implementations must be safe to call concurrently from different threads.
 *
 * @author ancombc-bias-em developers
 */
public interface LowerBoundedScalarMinimizer {

    ScalarMinimizerSummary minimize(@Nonnull final UnivariateFunction objective, final double lowerBound,
                                    final double start);

    default ScalarMinimizerSummary minimizeNonNegative(@Nonnull final UnivariateFunction objective,
                                                       final double start) {
        return minimize(objective, 0.0, start);
    }
}
