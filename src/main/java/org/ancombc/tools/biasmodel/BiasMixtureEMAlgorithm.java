package org.ancombc.tools.biasmodel;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.MathArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Maximum likelihood estimation of the bias mixture model parameters via the EM algorithm.
 *
 * Each iteration runs an E-step ({@link BiasMixtureResponsibilityCalculator}) followed by an M-step
 * ({@link BiasMixtureParameterUpdater}). The loop stops as soon as the Euclidean norm of the change of the
 * full parameter vector is no larger than the tolerance, or after the maximum number of iterations. The
 * estimate is the last M-step output; if no iteration is allowed the initial parameters are returned as is.
 *
 * Only the previous and the current parameters are kept; the full sequence of iterates is recorded only
 * when tracing is enabled in {@link BiasMixtureEMParams}.
 *
 * @author ancombc-bias-em developers
 */
public final class BiasMixtureEMAlgorithm {

    private final Logger logger = LogManager.getLogger(BiasMixtureEMAlgorithm.class);

    public static final String ERROR_NORM_KEY = "error_norm";
    public static final String LOG_LIKELIHOOD_KEY = "log_likelihood";
    public static final String DEGENERATE_TAXA_KEY = "degenerate_taxa";
    public static final String KAPPA1_EVALUATIONS_KEY = "kappa1_evaluations";
    public static final String KAPPA2_EVALUATIONS_KEY = "kappa2_evaluations";

    public enum EMAlgorithmStatus {
        TBD(false, "Status is not determined yet."),
        SUCCESS_PARAMS_TOL(true, "Success -- converged in parameters change tolerance."),
        FAILURE_MAX_ITERS_REACHED(false, "Failure -- maximum iterations reached."),
        FAILURE_UNDEFINED_PARAMETERS(false, "Failure -- some parameters are undefined (degenerate input)."),
        SKIPPED_NO_ITERATIONS(false, "No iterations were allowed -- the initial parameters are returned.");

        final boolean success;
        final String message;

        EMAlgorithmStatus(final boolean success, final String message) {
            this.success = success;
            this.message = message;
        }

        public boolean isSuccess() { return success; }

        public String getMessage() { return message; }
    }

    private final class IterationInfo {
        double logLikelihood, errorNorm;
        int iter;

        IterationInfo(final double logLikelihood, final double errorNorm, final int iter) {
            this.logLikelihood = logLikelihood;
            this.errorNorm = errorNorm;
            this.iter = iter;
        }

        void increaseIterationCount() {
            iter++;
        }
    }

    private final BiasMixtureEMParams params;
    private final BiasMixtureData data;
    private final BiasMixtureParameters initialParameters;
    private final BiasMixtureResponsibilityCalculator responsibilityCalculator;
    private final BiasMixtureParameterUpdater parameterUpdater;

    private BiasMixtureParameters previousParameters;
    private BiasMixtureParameters currentParameters;
    private BiasMixtureResponsibilities responsibilities;
    private final List<BiasMixtureParameters> trace = new ArrayList<>();
    private EMAlgorithmStatus status;
    private int iterations;
    private double errorNorm;
    private boolean degenerateTaxaReported;

    public BiasMixtureEMAlgorithm(@Nonnull final BiasMixtureData data,
                                  @Nonnull final BiasMixtureParameters initialParameters,
                                  @Nonnull final BiasMixtureEMParams params) {
        this.data = Validate.notNull(data, "The bias mixture data can not be null.");
        this.initialParameters = Validate.notNull(initialParameters, "The initial parameters can not be null.");
        this.params = Validate.notNull(params, "Bias mixture EM algorithm parameters can not be null.");
        Validate.isTrue(Arrays.stream(initialParameters.toArray()).allMatch(Double::isFinite),
                "All initial parameters must be finite: %s", initialParameters);
        Validate.isTrue(initialParameters.satisfiesSignConstraints(),
                "The initial parameters must satisfy l1 <= 0, l2 >= 0, kappa1 >= 0 and kappa2 >= 0: %s",
                initialParameters);
        responsibilityCalculator = new BiasMixtureResponsibilityCalculator(params.parallelEStepEnabled());
        parameterUpdater = new BiasMixtureParameterUpdater(params.createKappaMinimizer(),
                params.getMixtureWeightNormalization(), params.concurrentKappaUpdatesEnabled());
        reset();
        logger.info("EM algorithm initialized with " + data.getNumTaxa() + " taxa.");
    }

    /**
     * Estimates the bias mixture model parameters with default settings apart from the stopping criteria
     *
     * @param observations per-taxon log-ratio differences
     * @param variances per-taxon variances of {@code observations}
     * @param initialParameters starting point of the EM iterations
     * @param tol tolerance on the norm of the parameter change
     * @param maxIterations maximum number of EM iterations
     * @return the last iterate
     */
    public static BiasMixtureParameters estimate(@Nonnull final double[] observations,
                                                 @Nonnull final double[] variances,
                                                 @Nonnull final BiasMixtureParameters initialParameters,
                                                 final double tol, final int maxIterations) {
        final BiasMixtureEMParams params = new BiasMixtureEMParams()
                .setTolerance(tol)
                .setMaxIterations(maxIterations);
        return new BiasMixtureEMAlgorithm(new BiasMixtureData(observations, variances), initialParameters, params)
                .runExpectationMaximization();
    }

    private void reset() {
        previousParameters = null;
        currentParameters = initialParameters;
        responsibilities = null;
        trace.clear();
        if (params.traceEnabled()) {
            trace.add(initialParameters);
        }
        status = EMAlgorithmStatus.TBD;
        iterations = 0;
        errorNorm = Double.POSITIVE_INFINITY;
        degenerateTaxaReported = false;
    }

    public void showIterationHeader() {
        final String header = String.format("%-15s%-20s%-20s%-20s%-20s", "Iterations", "Type", "Log Likelihood",
                "Update Size", "Misc.");
        logger.info(header);
        logger.info(StringUtils.repeat("=", header.length()));
    }

    public void showIterationInfo(final int iter, final String type, final double logLikelihood,
                                  final double updateSize, final String misc) {
        final String row = String.format("%-15d%-20s%-20.6e%-20.6e%-20s", iter, type, logLikelihood,
                updateSize, misc);
        logger.info(row);
    }

    private SubroutineSignal runRoutine(@Nonnull final Supplier<SubroutineSignal> func,
                                        @Nonnull final Function<SubroutineSignal, String> miscFactory,
                                        @Nonnull final String name,
                                        final IterationInfo iterInfo) {
        final SubroutineSignal sig = func.get();
        iterInfo.errorNorm = sig.getDouble(ERROR_NORM_KEY);
        if (sig.contains(LOG_LIKELIHOOD_KEY)) {
            iterInfo.logLikelihood = sig.getDouble(LOG_LIKELIHOOD_KEY);
        }
        if (params.iterationLoggingEnabled()) {
            showIterationInfo(iterInfo.iter, name, iterInfo.logLikelihood, iterInfo.errorNorm,
                    miscFactory.apply(sig));
        }
        return sig;
    }

    /**
     * Runs the EM iterations from the initial parameters
     *
     * @return the estimated parameters
     */
    public BiasMixtureParameters runExpectationMaximization() {
        reset();
        if (params.getMaxIterations() == 0) {
            status = EMAlgorithmStatus.SKIPPED_NO_ITERATIONS;
            performPostEMOperations();
            return currentParameters;
        }

        if (params.iterationLoggingEnabled()) {
            showIterationHeader();
        }
        final IterationInfo iterInfo = new IterationInfo(
                params.iterationLoggingEnabled() ? getLogLikelihood() : Double.NaN, 0, 0);

        while (errorNorm > params.getTolerance() && iterInfo.iter < params.getMaxIterations()) {
            runRoutine(this::updateResponsibilities,
                    s -> "degenerate taxa: " + s.getInteger(DEGENERATE_TAXA_KEY), "E_STEP", iterInfo);
            final SubroutineSignal mStepSignal = runRoutine(this::updateParameters,
                    s -> String.format("kappa evals: %d, %d", s.getInteger(KAPPA1_EVALUATIONS_KEY),
                            s.getInteger(KAPPA2_EVALUATIONS_KEY)), "M_STEP", iterInfo);
            errorNorm = mStepSignal.getDouble(ERROR_NORM_KEY);
            iterInfo.increaseIterationCount();
            iterations = iterInfo.iter;
        }

        if (currentParameters.hasUndefinedValues()) {
            status = EMAlgorithmStatus.FAILURE_UNDEFINED_PARAMETERS;
        } else if (errorNorm <= params.getTolerance()) {
            status = EMAlgorithmStatus.SUCCESS_PARAMS_TOL;
        } else {
            status = EMAlgorithmStatus.FAILURE_MAX_ITERS_REACHED;
        }

        performPostEMOperations();
        return currentParameters;
    }

    private void performPostEMOperations() {
        logger.info("EM algorithm status: " + status.message);
        if (status == EMAlgorithmStatus.FAILURE_UNDEFINED_PARAMETERS) {
            logger.warn("Bias mixture parameters are undefined after " + iterations + " iterations: " +
                    currentParameters);
        } else {
            logger.info("Final parameters after " + iterations + " iterations: " + currentParameters);
        }
    }

    /**
     * E-step -- update the responsibilities using the current parameters
     */
    public SubroutineSignal updateResponsibilities() {
        final BiasMixtureResponsibilities newResponsibilities =
                responsibilityCalculator.calculate(data, currentParameters);
        final double change = responsibilities == null ? 0 : responsibilityChange(responsibilities, newResponsibilities);
        responsibilities = newResponsibilities;
        final int degenerateTaxa = newResponsibilities.getNumberOfDegenerateTaxa();
        if (degenerateTaxa > 0 && !degenerateTaxaReported) {
            logger.warn(degenerateTaxa + " taxa have a vanishing mixture density; their responsibilities are" +
                    " set to zero.");
            degenerateTaxaReported = true;
        }
        return SubroutineSignal.builder()
                .put(ERROR_NORM_KEY, change)
                .put(DEGENERATE_TAXA_KEY, degenerateTaxa)
                .build();
    }

    /**
     * M-step -- update the parameters using the latest responsibilities
     */
    public SubroutineSignal updateParameters() {
        if (responsibilities == null) {
            throw new IllegalStateException("The E-step must be performed before the M-step.");
        }
        final BiasMixtureParameterUpdater.Update update =
                parameterUpdater.update(data, currentParameters, responsibilities);
        previousParameters = currentParameters;
        currentParameters = update.getParameters();
        if (params.traceEnabled()) {
            trace.add(currentParameters);
        }
        final SubroutineSignal.SubroutineSignalBuilder sig = SubroutineSignal.builder()
                .put(ERROR_NORM_KEY, currentParameters.distance(previousParameters))
                .put(KAPPA1_EVALUATIONS_KEY, update.getKappa1Summary().evaluations)
                .put(KAPPA2_EVALUATIONS_KEY, update.getKappa2Summary().evaluations);
        /* the parameters only change here, so the E-step row reuses this value */
        if (params.iterationLoggingEnabled()) {
            sig.put(LOG_LIKELIHOOD_KEY, getLogLikelihood());
        }
        return sig.build();
    }

    private static double responsibilityChange(final BiasMixtureResponsibilities before,
                                               final BiasMixtureResponsibilities after) {
        double sumSq = 0;
        for (int k = 0; k < BiasMixtureResponsibilities.NUMBER_OF_COMPONENTS; k++) {
            final double d = MathArrays.distance(before.getComponent(k), after.getComponent(k));
            sumSq += d * d;
        }
        return FastMath.sqrt(sumSq);
    }

    /**
     * Mixture log likelihood at the current parameters
     */
    public double getLogLikelihood() {
        return BiasMixtureResponsibilityCalculator.logLikelihood(data, currentParameters);
    }

    public EMAlgorithmStatus getStatus() { return status; }

    public int getIterations() { return iterations; }

    /**
     * @return the norm of the last parameter change, or {@link Double#POSITIVE_INFINITY} if no iteration was run
     */
    public double getErrorNorm() { return errorNorm; }

    public BiasMixtureParameters getCurrentParameters() { return currentParameters; }

    /**
     * @return the parameters before the last M-step, or null if no M-step was run
     */
    public BiasMixtureParameters getPreviousParameters() { return previousParameters; }

    /**
     * @return the responsibilities of the last E-step, or null if no E-step was run
     */
    public BiasMixtureResponsibilities getResponsibilities() { return responsibilities; }

    /**
     * @return the initial parameters followed by every iterate, if tracing is enabled; otherwise an empty list
     */
    public List<BiasMixtureParameters> getTrace() { return Collections.unmodifiableList(trace); }
}
