package org.ancombc.tools.biasmodel.math;

import javax.annotation.Nonnull;

/**
 * Numerical helpers of the bias mixture model.
 *
 * The "NaN-skipping" reductions below ignore undefined terms instead of propagating them. A reduction
 * over no defined term is itself undefined and returns {@link Double#NaN}.
 *
 * @author ancombc-bias-em developers
 */
public final class BiasMixtureMathUtils {

    private BiasMixtureMathUtils() {}

    public static double nanSkippingSum(@Nonnull final double[] values) {
        double sum = 0;
        int defined = 0;
        for (final double value : values) {
            if (!Double.isNaN(value)) {
                sum += value;
                defined++;
            }
        }
        return defined == 0 ? Double.NaN : sum;
    }

    public static double nanSkippingMean(@Nonnull final double[] values) {
        double sum = 0;
        int defined = 0;
        for (final double value : values) {
            if (!Double.isNaN(value)) {
                sum += value;
                defined++;
            }
        }
        return defined == 0 ? Double.NaN : sum / defined;
    }

    /**
     * Ratio of two NaN-skipping sums; undefined when either sum is undefined or the denominator vanishes.
     */
    public static double nanSkippingRatio(@Nonnull final double[] numeratorTerms,
                                          @Nonnull final double[] denominatorTerms) {
        final double numerator = nanSkippingSum(numeratorTerms);
        final double denominator = nanSkippingSum(denominatorTerms);
        if (Double.isNaN(numerator) || Double.isNaN(denominator) || denominator == 0) {
            return Double.NaN;
        }
        return numerator / denominator;
    }

}
