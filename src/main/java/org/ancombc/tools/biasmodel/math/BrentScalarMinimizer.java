package org.ancombc.tools.biasmodel.math;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;

/**
 * Minimization of a scalar objective with Brent's method on the finite bracket [lower, lower + searchWidth].
 *
 * The half-line is truncated to a bracket because {@link BrentOptimizer} needs a finite search interval;
 * {@code searchWidth} must be chosen large enough to contain the minimum of interest.
 *
 * @author ancombc-bias-em developers
 */
public final class BrentScalarMinimizer implements LowerBoundedScalarMinimizer {

    private static final Logger logger = LogManager.getLogger(BrentScalarMinimizer.class);

    /* smallest relative tolerance accepted by BrentOptimizer */
    private static final double MIN_RELATIVE_ACCURACY = 2 * FastMath.ulp(1d);

    private final ScalarMinimizerDescription description;
    private final double searchWidth;

    public BrentScalarMinimizer(@Nonnull final ScalarMinimizerDescription description, final double searchWidth) {
        this.description = Validate.notNull(description, "The minimizer description must be non-null.");
        Validate.isTrue(searchWidth > 0, "The width of the Brent search interval must be positive.");
        this.searchWidth = searchWidth;
    }

    @Override
    public ScalarMinimizerSummary minimize(@Nonnull final UnivariateFunction objective, final double lowerBound,
                                           final double start) {
        Validate.notNull(objective, "The objective function must be non-null.");
        Validate.finite(lowerBound, "The lower bound must be finite.");
        Validate.finite(start, "The starting point must be finite.");

        final double upperBound = lowerBound + searchWidth;
        final double x0 = FastMath.min(upperBound, FastMath.max(lowerBound, start));
        final BestPointTracker tracker = new BestPointTracker(objective);
        final BrentOptimizer optimizer = new BrentOptimizer(
                FastMath.max(MIN_RELATIVE_ACCURACY, description.getRelativeAccuracy()),
                description.getAbsoluteAccuracy());
        try {
            final UnivariatePointValuePair optimum = optimizer.optimize(
                    new MaxEval(description.getMaxEvaluations()),
                    new UnivariateObjectiveFunction(tracker),
                    GoalType.MINIMIZE,
                    new SearchInterval(lowerBound, upperBound, x0));
            return new ScalarMinimizerSummary(optimum.getPoint(), optimum.getValue(), optimizer.getEvaluations(),
                    ScalarMinimizerSummary.ScalarMinimizerStatus.SUCCESS);
        } catch (final TooManyEvaluationsException ex) {
            final double x = tracker.hasBestPoint() ? tracker.getBestPoint() : x0;
            final double value = tracker.hasBestPoint() ? tracker.getBestValue() : objective.value(x0);
            logger.warn(String.format("Brent minimization did not converge within %d evaluations;" +
                    " using the best point found (x = %.6e)", description.getMaxEvaluations(), x));
            return new ScalarMinimizerSummary(x, value, description.getMaxEvaluations(),
                    ScalarMinimizerSummary.ScalarMinimizerStatus.TOO_MANY_EVALUATIONS);
        }
    }
}
