package org.ancombc.tools.biasmodel.math;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;

/**
 * Derivative-free minimization of a scalar objective on [lower, infinity) with the Nelder-Mead simplex method.
 *
 * {@link SimplexOptimizer} does not support simple bounds, so the objective is evaluated at the projection
 * of each candidate point onto the feasible half-line, and the final point is projected in the same way.
 * The objective is therefore flat below the bound and the simplex stops once it has collapsed onto it.
 *
 * The size of the initial simplex is {@code initialStepFraction * |start|}, but never smaller than
 * {@code minimumInitialStep}.
 *
 * @author ancombc-bias-em developers
 */
public final class NelderMeadScalarMinimizer implements LowerBoundedScalarMinimizer {

    private static final Logger logger = LogManager.getLogger(NelderMeadScalarMinimizer.class);

    private final ScalarMinimizerDescription description;
    private final double initialStepFraction;
    private final double minimumInitialStep;

    public NelderMeadScalarMinimizer(@Nonnull final ScalarMinimizerDescription description,
                                     final double initialStepFraction,
                                     final double minimumInitialStep) {
        this.description = Validate.notNull(description, "The minimizer description must be non-null.");
        Validate.isTrue(initialStepFraction > 0, "The initial simplex step fraction must be positive.");
        this.initialStepFraction = initialStepFraction;
        Validate.isTrue(minimumInitialStep > 0, "The minimum initial simplex step must be positive.");
        this.minimumInitialStep = minimumInitialStep;
    }

    @Override
    public ScalarMinimizerSummary minimize(@Nonnull final UnivariateFunction objective, final double lowerBound,
                                           final double start) {
        Validate.notNull(objective, "The objective function must be non-null.");
        Validate.finite(lowerBound, "The lower bound must be finite.");
        Validate.finite(start, "The starting point must be finite.");

        final double x0 = FastMath.max(lowerBound, start);
        final BestPointTracker tracker = new BestPointTracker(x -> objective.value(FastMath.max(lowerBound, x)));
        final double step = FastMath.max(initialStepFraction * FastMath.abs(x0), minimumInitialStep);

        /* a fresh optimizer per job keeps concurrent calls independent */
        final SimplexOptimizer optimizer = new SimplexOptimizer(description.getRelativeAccuracy(),
                description.getAbsoluteAccuracy());
        try {
            final PointValuePair optimum = optimizer.optimize(
                    new MaxEval(description.getMaxEvaluations()),
                    new ObjectiveFunction(point -> tracker.value(point[0])),
                    GoalType.MINIMIZE,
                    new InitialGuess(new double[] {x0}),
                    new NelderMeadSimplex(new double[] {step}));
            final double x = FastMath.max(lowerBound, optimum.getPoint()[0]);
            return new ScalarMinimizerSummary(x, optimum.getValue(), optimizer.getEvaluations(),
                    ScalarMinimizerSummary.ScalarMinimizerStatus.SUCCESS);
        } catch (final TooManyEvaluationsException ex) {
            final double x = tracker.hasBestPoint() ? FastMath.max(lowerBound, tracker.getBestPoint()) : x0;
            final double value = tracker.hasBestPoint() ? tracker.getBestValue() : objective.value(x0);
            logger.warn(String.format("Nelder-Mead minimization did not converge within %d evaluations;" +
                    " using the best point found (x = %.6e)", description.getMaxEvaluations(), x));
            return new ScalarMinimizerSummary(x, value, description.getMaxEvaluations(),
                    ScalarMinimizerSummary.ScalarMinimizerStatus.TOO_MANY_EVALUATIONS);
        }
    }
}
