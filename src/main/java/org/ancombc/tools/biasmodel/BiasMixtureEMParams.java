package org.ancombc.tools.biasmodel;

import org.ancombc.tools.biasmodel.math.BrentScalarMinimizer;
import org.ancombc.tools.biasmodel.math.LowerBoundedScalarMinimizer;
import org.ancombc.tools.biasmodel.math.NelderMeadScalarMinimizer;
import org.ancombc.tools.biasmodel.math.ScalarMinimizerDescription;

import org.apache.commons.lang3.Validate;

import javax.annotation.Nonnull;

/**
 * Parameters for {@link BiasMixtureEMAlgorithm}.
 *
 * @author ancombc-bias-em developers
 */
public class BiasMixtureEMParams {

    public enum KappaSolverType {
        KAPPA_VIA_NELDER_MEAD,
        KAPPA_VIA_BRENT
    }

    public enum MixtureWeightNormalization {
        /**
         * Weights are the column means of the responsibilities. They sum to less than one when some taxa are
         * degenerate.
         */
        COLUMN_MEANS,

        /**
         * Column means divided by their sum (when the sum is positive)
         */
        RENORMALIZED
    }

    public static final double DEFAULT_TOLERANCE = 1e-5;
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    /* stopping criterion w.r.t. the Euclidean norm of the change in the model parameters */
    private double tolerance = DEFAULT_TOLERANCE;

    /* maximum number of EM iterations */
    private int maxIterations = DEFAULT_MAX_ITERATIONS;

    /* kappa solver type */
    private KappaSolverType kappaSolverType = KappaSolverType.KAPPA_VIA_NELDER_MEAD;

    /* M-step error tolerance in minimizing w.r.t. kappa */
    private double kappaAbsTol = 1e-8;
    private double kappaRelTol = 1e-8;

    /* M-step maximum objective evaluations in minimizing w.r.t. kappa */
    private int kappaMaxEvaluations = 1000;

    /* initial Nelder-Mead simplex size, relative to the current kappa, and its floor */
    private double nelderMeadInitialStepFraction = 0.1;
    private double nelderMeadMinimumInitialStep = 0.1;

    /* the Brent solver searches kappa in [0, kappaBrentUpperLimit] */
    private double kappaBrentUpperLimit = 1e4;

    private MixtureWeightNormalization mixtureWeightNormalization = MixtureWeightNormalization.COLUMN_MEANS;

    private boolean parallelEStepEnabled = false;

    private boolean concurrentKappaUpdatesEnabled = false;

    private boolean traceEnabled = false;

    private boolean iterationLoggingEnabled = true;

    /********************************
     * accessor and mutator methods *
     ********************************/

    public BiasMixtureEMParams setTolerance(final double tol) {
        Validate.isTrue(tol > 0, "The required tolerance on the parameter change must be positive.");
        tolerance = tol;
        return this;
    }

    public double getTolerance() { return tolerance; }

    public BiasMixtureEMParams setMaxIterations(final int maxIterations) {
        Validate.isTrue(maxIterations >= 0, "Maximum EM iterations must be non-negative.");
        this.maxIterations = maxIterations;
        return this;
    }

    public int getMaxIterations() { return maxIterations; }

    public BiasMixtureEMParams setKappaSolverType(@Nonnull final KappaSolverType kappaSolverType) {
        this.kappaSolverType = Validate.notNull(kappaSolverType, "The kappa solver type must be non-null.");
        return this;
    }

    public KappaSolverType getKappaSolverType() { return kappaSolverType; }

    public BiasMixtureEMParams setKappaAbsoluteTolerance(final double tol) {
        Validate.isTrue(tol > 0, "The absolute tolerance for minimization of kappa must be positive.");
        this.kappaAbsTol = tol;
        return this;
    }

    public double getKappaAbsoluteTolerance() { return kappaAbsTol; }

    public BiasMixtureEMParams setKappaRelativeTolerance(final double tol) {
        Validate.isTrue(tol > 0, "The relative tolerance for minimization of kappa must be positive.");
        this.kappaRelTol = tol;
        return this;
    }

    public double getKappaRelativeTolerance() { return kappaRelTol; }

    public BiasMixtureEMParams setKappaMaxEvaluations(final int kappaMaxEvaluations) {
        Validate.isTrue(kappaMaxEvaluations > 0, "The maximum number of evaluations" +
                " for the M-step of kappa must be positive.");
        this.kappaMaxEvaluations = kappaMaxEvaluations;
        return this;
    }

    public int getKappaMaxEvaluations() { return kappaMaxEvaluations; }

    public BiasMixtureEMParams setNelderMeadInitialStepFraction(final double fraction) {
        Validate.isTrue(fraction > 0, "The initial simplex step fraction" +
                " must be positive.");
        this.nelderMeadInitialStepFraction = fraction;
        return this;
    }

    public double getNelderMeadInitialStepFraction() { return nelderMeadInitialStepFraction; }

    public BiasMixtureEMParams setNelderMeadMinimumInitialStep(final double step) {
        Validate.isTrue(step > 0, "The minimum initial simplex step" +
                " must be positive.");
        this.nelderMeadMinimumInitialStep = step;
        return this;
    }

    public double getNelderMeadMinimumInitialStep() { return nelderMeadMinimumInitialStep; }

    public BiasMixtureEMParams setKappaBrentUpperLimit(final double upperLimit) {
        Validate.isTrue(upperLimit > 0, "The upper limit of kappa for the Brent" +
                " solver must be positive.");
        this.kappaBrentUpperLimit = upperLimit;
        return this;
    }

    public double getKappaBrentUpperLimit() { return kappaBrentUpperLimit; }

    public BiasMixtureEMParams setMixtureWeightNormalization(@Nonnull final MixtureWeightNormalization normalization) {
        this.mixtureWeightNormalization = Validate.notNull(normalization, "The mixture weight normalization must" +
                " be non-null.");
        return this;
    }

    public MixtureWeightNormalization getMixtureWeightNormalization() { return mixtureWeightNormalization; }

    public BiasMixtureEMParams enableParallelEStep() {
        parallelEStepEnabled = true;
        return this;
    }

    public BiasMixtureEMParams disableParallelEStep() {
        parallelEStepEnabled = false;
        return this;
    }

    public boolean parallelEStepEnabled() { return parallelEStepEnabled; }

    public BiasMixtureEMParams enableConcurrentKappaUpdates() {
        concurrentKappaUpdatesEnabled = true;
        return this;
    }

    public BiasMixtureEMParams disableConcurrentKappaUpdates() {
        concurrentKappaUpdatesEnabled = false;
        return this;
    }

    public boolean concurrentKappaUpdatesEnabled() { return concurrentKappaUpdatesEnabled; }

    public BiasMixtureEMParams enableTrace() {
        traceEnabled = true;
        return this;
    }

    public BiasMixtureEMParams disableTrace() {
        traceEnabled = false;
        return this;
    }

    public boolean traceEnabled() { return traceEnabled; }

    public BiasMixtureEMParams enableIterationLogging() {
        iterationLoggingEnabled = true;
        return this;
    }

    public BiasMixtureEMParams disableIterationLogging() {
        iterationLoggingEnabled = false;
        return this;
    }

    public boolean iterationLoggingEnabled() { return iterationLoggingEnabled; }

    /**
     * Instantiates the kappa minimizer described by these parameters
     */
    public LowerBoundedScalarMinimizer createKappaMinimizer() {
        final ScalarMinimizerDescription description = new ScalarMinimizerDescription(kappaAbsTol, kappaRelTol,
                kappaMaxEvaluations);
        switch (kappaSolverType) {
            case KAPPA_VIA_NELDER_MEAD:
                return new NelderMeadScalarMinimizer(description, nelderMeadInitialStepFraction,
                        nelderMeadMinimumInitialStep);
            case KAPPA_VIA_BRENT:
                return new BrentScalarMinimizer(description, kappaBrentUpperLimit);
            default:
                throw new IllegalStateException("Unknown kappa solver type: " + kappaSolverType);
        }
    }
}
