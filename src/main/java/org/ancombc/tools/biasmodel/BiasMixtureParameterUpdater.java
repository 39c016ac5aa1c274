package org.ancombc.tools.biasmodel;

import org.ancombc.tools.biasmodel.math.BiasMixtureMathUtils;
import org.ancombc.tools.biasmodel.math.LowerBoundedScalarMinimizer;
import org.ancombc.tools.biasmodel.math.ScalarMinimizerSummary;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.util.FastMath;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * M-step of the bias mixture model. Given the responsibilities computed from the current parameters, the
 * next iterate is
 *
 * <dl>
 *     <dt> pi_k </dt> <dd> mean responsibility of component k </dd>
 *     <dt> delta </dt> <dd> precision-weighted mean of D_i, D_i - l1 and D_i - l2 over the three components </dd>
 *     <dt> l1, l2 </dt> <dd> precision-weighted mean of D_i - delta in components 1 and 2, clamped to l1 &lt;= 0
 *     and l2 &gt;= 0 </dd>
 *     <dt> kappa1, kappa2 </dt> <dd> minimizers over [0, infinity) of the responsibility-weighted negative log
 *     likelihood of components 1 and 2 </dd>
 * </dl>
 *
 * All updates read the current parameters only; none reads a value already updated in the same step.
 * Undefined (NaN) per-taxon terms are excluded from every sum.
 *
 * @author ancombc-bias-em developers
 */
public final class BiasMixtureParameterUpdater {

    private final LowerBoundedScalarMinimizer kappaMinimizer;
    private final BiasMixtureEMParams.MixtureWeightNormalization weightNormalization;
    private final boolean concurrentKappaUpdates;

    public BiasMixtureParameterUpdater(@Nonnull final LowerBoundedScalarMinimizer kappaMinimizer,
                                       @Nonnull final BiasMixtureEMParams.MixtureWeightNormalization weightNormalization,
                                       final boolean concurrentKappaUpdates) {
        this.kappaMinimizer = Validate.notNull(kappaMinimizer, "The kappa minimizer must be non-null.");
        this.weightNormalization = Validate.notNull(weightNormalization, "The weight normalization must be non-null.");
        this.concurrentKappaUpdates = concurrentKappaUpdates;
    }

    /**
     * Result of one M-step: the new parameters and the summaries of the two kappa minimizations
     */
    public static final class Update {
        private final BiasMixtureParameters parameters;
        private final ScalarMinimizerSummary kappa1Summary, kappa2Summary;

        Update(final BiasMixtureParameters parameters, final ScalarMinimizerSummary kappa1Summary,
               final ScalarMinimizerSummary kappa2Summary) {
            this.parameters = parameters;
            this.kappa1Summary = kappa1Summary;
            this.kappa2Summary = kappa2Summary;
        }

        public BiasMixtureParameters getParameters() { return parameters; }

        public ScalarMinimizerSummary getKappa1Summary() { return kappa1Summary; }

        public ScalarMinimizerSummary getKappa2Summary() { return kappa2Summary; }
    }

    public Update update(@Nonnull final BiasMixtureData data,
                         @Nonnull final BiasMixtureParameters params,
                         @Nonnull final BiasMixtureResponsibilities resp) {
        Validate.notNull(data, "The bias mixture data must be non-null.");
        Validate.notNull(params, "The bias mixture parameters must be non-null.");
        Validate.notNull(resp, "The responsibilities must be non-null.");
        Validate.isTrue(data.getNumTaxa() == resp.getNumTaxa(), "The responsibilities do not match the data.");

        final double[] r0 = resp.getComponent(BiasMixtureResponsibilities.NULL_COMPONENT);
        final double[] r1 = resp.getComponent(BiasMixtureResponsibilities.NEGATIVE_SHIFT_COMPONENT);
        final double[] r2 = resp.getComponent(BiasMixtureResponsibilities.POSITIVE_SHIFT_COMPONENT);

        final double[] weights = updateMixtureWeights(r0, r1, r2);
        final double newDelta = updateDelta(data, params, r0, r1, r2);
        final double newL1 = updateShift(data, params.getDelta(), params.getKappa1(), r1, params.getL1(), true);
        final double newL2 = updateShift(data, params.getDelta(), params.getKappa2(), r2, params.getL2(), false);

        final double kappa1Mean = params.getDelta() + params.getL1();
        final double kappa2Mean = params.getDelta() + params.getL2();
        final ScalarMinimizerSummary kappa1Summary, kappa2Summary;
        if (concurrentKappaUpdates) {
            final CompletableFuture<ScalarMinimizerSummary> kappa2Job = CompletableFuture.supplyAsync(
                    () -> updateVarianceInflation(data, r2, kappa2Mean, params.getKappa2()));
            kappa1Summary = updateVarianceInflation(data, r1, kappa1Mean, params.getKappa1());
            kappa2Summary = join(kappa2Job);
        } else {
            kappa1Summary = updateVarianceInflation(data, r1, kappa1Mean, params.getKappa1());
            kappa2Summary = updateVarianceInflation(data, r2, kappa2Mean, params.getKappa2());
        }

        final BiasMixtureParameters newParams = new BiasMixtureParameters(weights[0], weights[1], weights[2],
                newDelta, newL1, newL2, kappa1Summary.x, kappa2Summary.x);
        return new Update(newParams, kappa1Summary, kappa2Summary);
    }

    double[] updateMixtureWeights(final double[] r0, final double[] r1, final double[] r2) {
        final double pi0 = BiasMixtureMathUtils.nanSkippingMean(r0);
        final double pi1 = BiasMixtureMathUtils.nanSkippingMean(r1);
        final double pi2 = BiasMixtureMathUtils.nanSkippingMean(r2);
        if (weightNormalization == BiasMixtureEMParams.MixtureWeightNormalization.RENORMALIZED) {
            final double total = pi0 + pi1 + pi2;
            if (total > 0 && Double.isFinite(total)) {
                return new double[] {pi0 / total, pi1 / total, pi2 / total};
            }
        }
        return new double[] {pi0, pi1, pi2};
    }

    static double updateDelta(final BiasMixtureData data, final BiasMixtureParameters params,
                              final double[] r0, final double[] r1, final double[] r2) {
        final int numTaxa = data.getNumTaxa();
        final double[] numeratorTerms = new double[numTaxa];
        final double[] denominatorTerms = new double[numTaxa];
        for (int i = 0; i < numTaxa; i++) {
            final double x = data.getObservation(i);
            final double v0 = data.getVariance(i);
            final double v1 = v0 + params.getKappa1();
            final double v2 = v0 + params.getKappa2();
            numeratorTerms[i] = r0[i] * x / v0 + r1[i] * (x - params.getL1()) / v1 + r2[i] * (x - params.getL2()) / v2;
            denominatorTerms[i] = r0[i] / v0 + r1[i] / v1 + r2[i] / v2;
        }
        return BiasMixtureMathUtils.nanSkippingRatio(numeratorTerms, denominatorTerms);
    }

    /**
     * Precision-weighted mean residual of one outlier component, projected onto its feasible half-line. When
     * the component carries no weight at all the mean is undefined and {@code currentShift} is kept.
     */
    static double updateShift(final BiasMixtureData data, final double delta, final double kappa,
                              final double[] resp, final double currentShift, final boolean nonPositive) {
        final int numTaxa = data.getNumTaxa();
        final double[] numeratorTerms = new double[numTaxa];
        final double[] denominatorTerms = new double[numTaxa];
        for (int i = 0; i < numTaxa; i++) {
            final double precision = resp[i] / (data.getVariance(i) + kappa);
            numeratorTerms[i] = precision * (data.getObservation(i) - delta);
            denominatorTerms[i] = precision;
        }
        final double shift = BiasMixtureMathUtils.nanSkippingRatio(numeratorTerms, denominatorTerms);
        if (Double.isNaN(shift)) {
            return currentShift;
        }
        return nonPositive ? FastMath.min(shift, 0.0) : FastMath.max(shift, 0.0);
    }

    /**
     * Objective of the kappa update of one outlier component:
     *
     *      g(x) = - sum_i r_i log N(D_i; mean, v_i + x)
     *
     * where a log density that is not finite (the density underflowed to zero) contributes 0 and undefined
     * products are skipped.
     */
    public static UnivariateFunction varianceInflationObjective(@Nonnull final BiasMixtureData data,
                                                                @Nonnull final double[] resp,
                                                                final double mean) {
        Validate.isTrue(resp.length == data.getNumTaxa(), "The responsibilities do not match the data.");
        final double[] weights = resp.clone();
        return x -> {
            double sum = 0;
            for (int i = 0; i < weights.length; i++) {
                double logDensity = FastMath.log(BiasMixtureResponsibilityCalculator.density(data.getObservation(i),
                        mean, data.getVariance(i) + x));
                if (Double.isInfinite(logDensity)) {
                    logDensity = 0;
                }
                final double term = weights[i] * logDensity;
                if (!Double.isNaN(term)) {
                    sum += term;
                }
            }
            return -sum;
        };
    }

    /**
     * Minimizes {@link #varianceInflationObjective} over [0, infinity) starting from {@code currentKappa}
     */
    ScalarMinimizerSummary updateVarianceInflation(@Nonnull final BiasMixtureData data,
                                                   @Nonnull final double[] resp,
                                                   final double mean, final double currentKappa) {
        return kappaMinimizer.minimizeNonNegative(varianceInflationObjective(data, resp, mean), currentKappa);
    }

    private static ScalarMinimizerSummary join(final CompletableFuture<ScalarMinimizerSummary> job) {
        try {
            return job.join();
        } catch (final CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw ex;
        }
    }
}
