package org.ancombc.tools.biasmodel;

import org.apache.commons.math3.util.MathArrays;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Parameters of the three-component bias mixture model:
 *
 * <dl>
 *     <dt> pi0, pi1, pi2 </dt> <dd> weights of the null, negative-shift and positive-shift components </dd>
 *     <dt> delta </dt> <dd> global bias, the mean of the null component </dd>
 *     <dt> l1 &lt;= 0, l2 &gt;= 0 </dt> <dd> mean shifts of the two outlier components relative to delta </dd>
 *     <dt> kappa1, kappa2 &gt;= 0 </dt> <dd> variance added to the known taxon variance in the outlier components </dd>
 * </dl>
 *
 * The sign constraints are maintained by the EM updates, not by this class, so that the initial state of
 * the caller is reported back exactly when no iteration is performed.
 *
 * @author ancombc-bias-em developers
 */
public final class BiasMixtureParameters implements Serializable {

    private static final long serialVersionUID = 3528906184623370191L;

    public static final int NUMBER_OF_PARAMETERS = 8;

    private final double pi0, pi1, pi2;
    private final double delta;
    private final double l1, l2;
    private final double kappa1, kappa2;

    public BiasMixtureParameters(final double pi0, final double pi1, final double pi2, final double delta,
                                 final double l1, final double l2, final double kappa1, final double kappa2) {
        this.pi0 = pi0;
        this.pi1 = pi1;
        this.pi2 = pi2;
        this.delta = delta;
        this.l1 = l1;
        this.l2 = l2;
        this.kappa1 = kappa1;
        this.kappa2 = kappa2;
    }

    public double getPi0() { return pi0; }

    public double getPi1() { return pi1; }

    public double getPi2() { return pi2; }

    public double getDelta() { return delta; }

    public double getL1() { return l1; }

    public double getL2() { return l2; }

    public double getKappa1() { return kappa1; }

    public double getKappa2() { return kappa2; }

    public BiasMixtureParameters copyWithNewWeights(final double newPi0, final double newPi1, final double newPi2) {
        return new BiasMixtureParameters(newPi0, newPi1, newPi2, delta, l1, l2, kappa1, kappa2);
    }

    public BiasMixtureParameters copyWithNewDelta(final double newDelta) {
        return new BiasMixtureParameters(pi0, pi1, pi2, newDelta, l1, l2, kappa1, kappa2);
    }

    public BiasMixtureParameters copyWithNewShifts(final double newL1, final double newL2) {
        return new BiasMixtureParameters(pi0, pi1, pi2, delta, newL1, newL2, kappa1, kappa2);
    }

    public BiasMixtureParameters copyWithNewVarianceInflations(final double newKappa1, final double newKappa2) {
        return new BiasMixtureParameters(pi0, pi1, pi2, delta, l1, l2, newKappa1, newKappa2);
    }

    /**
     * @return (pi0, pi1, pi2, delta, l1, l2, kappa1, kappa2)
     */
    public double[] toArray() {
        return new double[] {pi0, pi1, pi2, delta, l1, l2, kappa1, kappa2};
    }

    /**
     * Euclidean norm of the change of the full parameter vector
     */
    public double distance(final BiasMixtureParameters other) {
        return MathArrays.distance(toArray(), other.toArray());
    }

    public boolean hasUndefinedValues() {
        return Arrays.stream(toArray()).anyMatch(Double::isNaN);
    }

    public boolean satisfiesSignConstraints() {
        return l1 <= 0 && l2 >= 0 && kappa1 >= 0 && kappa2 >= 0;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(toArray(), ((BiasMixtureParameters) o).toArray());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    @Override
    public String toString() {
        return String.format("BiasMixtureParameters{pi0=%.6g, pi1=%.6g, pi2=%.6g, delta=%.6g, l1=%.6g, l2=%.6g," +
                " kappa1=%.6g, kappa2=%.6g}", pi0, pi1, pi2, delta, l1, l2, kappa1, kappa2);
    }
}
