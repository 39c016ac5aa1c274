package org.ancombc.tools.biasmodel;

import org.apache.commons.lang3.Validate;

import javax.annotation.Nonnull;
import java.util.stream.IntStream;

/**
 * Posterior membership probabilities of each taxon in the null (0), negative-shift (1) and positive-shift (2)
 * components. A taxon whose mixture density vanishes carries the row (0, 0, 0), which is not a probability
 * vector; such taxa are reported as degenerate.
 *
 * @author ancombc-bias-em developers
 */
public final class BiasMixtureResponsibilities {

    public static final int NUMBER_OF_COMPONENTS = 3;

    public static final int NULL_COMPONENT = 0;
    public static final int NEGATIVE_SHIFT_COMPONENT = 1;
    public static final int POSITIVE_SHIFT_COMPONENT = 2;

    /* component-major storage */
    private final double[][] responsibilities;

    BiasMixtureResponsibilities(@Nonnull final double[] r0, @Nonnull final double[] r1, @Nonnull final double[] r2) {
        Validate.isTrue(r0.length == r1.length && r1.length == r2.length,
                "All components must have responsibilities for the same taxa.");
        this.responsibilities = new double[][] {r0, r1, r2};
    }

    public int getNumTaxa() {
        return responsibilities[NULL_COMPONENT].length;
    }

    public double get(final int taxonIndex, final int component) {
        return responsibilities[component][taxonIndex];
    }

    /**
     * @return a copy of the responsibilities of component {@code component} across taxa
     */
    public double[] getComponent(final int component) {
        Validate.isTrue(component >= 0 && component < NUMBER_OF_COMPONENTS, "Component index out of range: " + component);
        return responsibilities[component].clone();
    }

    public boolean isDegenerate(final int taxonIndex) {
        return responsibilities[NULL_COMPONENT][taxonIndex] == 0 &&
                responsibilities[NEGATIVE_SHIFT_COMPONENT][taxonIndex] == 0 &&
                responsibilities[POSITIVE_SHIFT_COMPONENT][taxonIndex] == 0;
    }

    public int getNumberOfDegenerateTaxa() {
        return (int) IntStream.range(0, getNumTaxa()).filter(this::isDegenerate).count();
    }
}
