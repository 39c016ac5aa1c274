package org.ancombc.tools.biasmodel;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.function.DoublePredicate;

/**
 * Starting point of the EM iterations derived from the empirical distribution of the observations:
 *
 * <dl>
 *     <dt> weights </dt> <dd> (0.75, 0.125, 0.125) </dd>
 *     <dt> delta </dt> <dd> mean of the observations between the first and third quartiles </dd>
 *     <dt> l1, kappa1 </dt> <dd> mean and sample variance of the observations below the 12.5% quantile </dd>
 *     <dt> l2, kappa2 </dt> <dd> mean and sample variance of the observations above the 87.5% quantile </dd>
 * </dl>
 *
 * Quantiles are the R type 7 estimates. Undefined or sign-violating values are replaced by fallbacks so that
 * the result always satisfies the constraints checked by {@link BiasMixtureEMAlgorithm}.
 *
 * @author ancombc-bias-em developers
 */
public final class BiasMixtureInitializer {

    private static final Logger logger = LogManager.getLogger(BiasMixtureInitializer.class);

    public static final double INITIAL_NULL_WEIGHT = 0.75;
    public static final double INITIAL_OUTLIER_WEIGHT = 0.125;
    public static final double DEFAULT_INITIAL_KAPPA = 1.0;

    private static final double LOWER_QUARTILE = 25;
    private static final double UPPER_QUARTILE = 75;
    private static final double LOWER_TAIL_QUANTILE = 12.5;
    private static final double UPPER_TAIL_QUANTILE = 87.5;

    private final double[] observations;

    public BiasMixtureInitializer(@Nonnull final BiasMixtureData data) {
        Validate.notNull(data, "The bias mixture data must be non-null.");
        Validate.isTrue(data.getNumTaxa() > 0, "At least one taxon is required to initialize the bias mixture model.");
        observations = data.getObservations();
    }

    public BiasMixtureParameters getInitializedParameters() {
        final Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(observations);
        final double q25 = percentile.evaluate(LOWER_QUARTILE);
        final double q75 = percentile.evaluate(UPPER_QUARTILE);
        final double qLow = percentile.evaluate(LOWER_TAIL_QUANTILE);
        final double qHigh = percentile.evaluate(UPPER_TAIL_QUANTILE);

        final double min = Arrays.stream(observations).min().getAsDouble();
        final double max = Arrays.stream(observations).max().getAsDouble();

        double delta = mean(x -> x >= q25 && x <= q75);
        if (Double.isNaN(delta)) {
            delta = new Mean().evaluate(observations);
        }

        double l1 = mean(x -> x < qLow);
        if (Double.isNaN(l1) || l1 > 0) {
            l1 = FastMath.min(min, 0.0);
        }
        double l2 = mean(x -> x > qHigh);
        if (Double.isNaN(l2) || l2 < 0) {
            l2 = FastMath.max(max, 0.0);
        }

        final double kappa1 = varianceOrDefault(x -> x < qLow);
        final double kappa2 = varianceOrDefault(x -> x > qHigh);

        final BiasMixtureParameters initial = new BiasMixtureParameters(INITIAL_NULL_WEIGHT, INITIAL_OUTLIER_WEIGHT,
                INITIAL_OUTLIER_WEIGHT, delta, l1, l2, kappa1, kappa2);
        logger.debug("Initial bias mixture parameters: " + initial);
        return initial;
    }

    private double[] select(final DoublePredicate predicate) {
        return Arrays.stream(observations).filter(predicate).toArray();
    }

    private double mean(final DoublePredicate predicate) {
        final double[] selected = select(predicate);
        return selected.length == 0 ? Double.NaN : new Mean().evaluate(selected);
    }

    /* sample variance needs two points; a zero variance would collapse the outlier component */
    private double varianceOrDefault(final DoublePredicate predicate) {
        final double[] selected = select(predicate);
        if (selected.length < 2) {
            return DEFAULT_INITIAL_KAPPA;
        }
        final double variance = new Variance(true).evaluate(selected);
        return Double.isNaN(variance) || variance == 0 ? DEFAULT_INITIAL_KAPPA : variance;
    }
}
