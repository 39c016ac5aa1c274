package org.ancombc.tools.biasmodel;

import org.apache.commons.lang3.Validate;

import javax.annotation.Nonnull;
import java.util.stream.IntStream;

/**
 * Per-taxon input of the bias mixture model: the between-group log-ratio differences and their known
 * sampling variances, in the same taxon order.
 *
 * @author ancombc-bias-em developers
 */
public final class BiasMixtureData {

    private final double[] observations;
    private final double[] variances;

    /**
     * @param observations per-taxon log-ratio differences (finite)
     * @param variances per-taxon sampling variances of {@code observations} (strictly positive)
     */
    public BiasMixtureData(@Nonnull final double[] observations, @Nonnull final double[] variances) {
        Validate.notNull(observations, "The observations must be non-null.");
        Validate.notNull(variances, "The variances must be non-null.");
        Validate.isTrue(observations.length == variances.length, "The number of observations (%d) and variances (%d)" +
                " must be the same.", observations.length, variances.length);
        Validate.isTrue(IntStream.range(0, observations.length).allMatch(i -> Double.isFinite(observations[i])),
                "All observations must be finite.");
        Validate.isTrue(IntStream.range(0, variances.length).allMatch(i -> variances[i] > 0 && Double.isFinite(variances[i])),
                "All variances must be positive and finite.");
        this.observations = observations.clone();
        this.variances = variances.clone();
    }

    public int getNumTaxa() {
        return observations.length;
    }

    public double getObservation(final int taxonIndex) {
        return observations[taxonIndex];
    }

    public double getVariance(final int taxonIndex) {
        return variances[taxonIndex];
    }

    public double[] getObservations() {
        return observations.clone();
    }
}
