package org.ancombc.tools.biasmodel;

import org.ancombc.tools.biasmodel.math.BiasMixtureMathUtils;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.util.FastMath;

import javax.annotation.Nonnull;
import java.util.stream.IntStream;

/**
 * E-step of the bias mixture model. For taxon i with observation D_i and variance v_i, the component
 * densities are
 *
 *      f0 = N(D_i; delta, v_i),  f1 = N(D_i; delta + l1, v_i + kappa1),  f2 = N(D_i; delta + l2, v_i + kappa2)
 *
 * and the responsibilities are r_k = pi_k f_k / (pi0 f0 + pi1 f1 + pi2 f2). If the normalization is zero or
 * not finite, the row is set to (0, 0, 0).
 *
 * Taxa are independent; with {@code parallel} the map over taxa runs on the common fork-join pool and
 * produces the same result as the sequential map.
 *
 * @author ancombc-bias-em developers
 */
public final class BiasMixtureResponsibilityCalculator {

    private final boolean parallel;

    public BiasMixtureResponsibilityCalculator(final boolean parallel) {
        this.parallel = parallel;
    }

    public BiasMixtureResponsibilities calculate(@Nonnull final BiasMixtureData data,
                                                 @Nonnull final BiasMixtureParameters params) {
        Validate.notNull(data, "The bias mixture data must be non-null.");
        Validate.notNull(params, "The bias mixture parameters must be non-null.");
        final int numTaxa = data.getNumTaxa();
        final double[] r0 = new double[numTaxa];
        final double[] r1 = new double[numTaxa];
        final double[] r2 = new double[numTaxa];
        final IntStream taxa = IntStream.range(0, numTaxa);
        (parallel ? taxa.parallel() : taxa).forEach(i -> {
            final double x = data.getObservation(i);
            final double v = data.getVariance(i);
            final double w0 = params.getPi0() * density(x, params.getDelta(), v);
            final double w1 = params.getPi1() * density(x, params.getDelta() + params.getL1(), v + params.getKappa1());
            final double w2 = params.getPi2() * density(x, params.getDelta() + params.getL2(), v + params.getKappa2());
            final double norm = w0 + w1 + w2;
            if (norm > 0 && Double.isFinite(norm)) {
                r0[i] = w0 / norm;
                r1[i] = w1 / norm;
                r2[i] = w2 / norm;
            } /* else leave the all-zero row */
        });
        return new BiasMixtureResponsibilities(r0, r1, r2);
    }

    /**
     * Mixture log likelihood, sum_i log(pi0 f0 + pi1 f1 + pi2 f2), over taxa with a positive and finite
     * mixture density. Returns {@link Double#NaN} when there are no such taxa.
     */
    public static double logLikelihood(@Nonnull final BiasMixtureData data,
                                       @Nonnull final BiasMixtureParameters params) {
        final double[] terms = IntStream.range(0, data.getNumTaxa()).mapToDouble(i -> {
            final double x = data.getObservation(i);
            final double v = data.getVariance(i);
            final double mixtureDensity = params.getPi0() * density(x, params.getDelta(), v)
                    + params.getPi1() * density(x, params.getDelta() + params.getL1(), v + params.getKappa1())
                    + params.getPi2() * density(x, params.getDelta() + params.getL2(), v + params.getKappa2());
            return mixtureDensity > 0 && Double.isFinite(mixtureDensity) ? FastMath.log(mixtureDensity) : Double.NaN;
        }).toArray();
        return BiasMixtureMathUtils.nanSkippingSum(terms);
    }

    /**
     * Normal density with mean {@code mean} and variance {@code variance} at {@code x}; underflows to 0 far in
     * the tails
     */
    static double density(final double x, final double mean, final double variance) {
        return new NormalDistribution(null, mean, FastMath.sqrt(variance)).density(x);
    }
}
