package org.ancombc.tools.biasmodel;

import org.ancombc.utils.test.BaseTest;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.random.RandomGenerator;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public final class BiasMixtureEMAlgorithmUnitTest extends BaseTest {

    private static final double TOL = 1e-5;
    private static final int MAX_ITERATIONS = 100;

    private static final int NUM_NULL_TAXA = 200;
    private static final int NUM_OUTLIER_TAXA = 20;
    private static final double TRUE_DELTA = 0.5;
    private static final double TRUE_OUTLIER_SHIFT = 3.0;
    private static final double KNOWN_VARIANCE = 0.05;
    private static final double OUTLIER_EXTRA_VARIANCE = 0.5;

    private static BiasMixtureEMParams defaultParams() {
        return new BiasMixtureEMParams().setTolerance(TOL).setMaxIterations(MAX_ITERATIONS);
    }

    /**
     * Null taxa around {@link #TRUE_DELTA} and a block of positive outliers shifted by {@link #TRUE_OUTLIER_SHIFT}
     */
    private static BiasMixtureData simulateData(final long seed) {
        final RandomGenerator rng = createRandomGenerator(seed);
        final double[] nullTaxa = normalSamples(rng, NUM_NULL_TAXA, TRUE_DELTA, KNOWN_VARIANCE);
        final double[] outliers = normalSamples(rng, NUM_OUTLIER_TAXA, TRUE_DELTA + TRUE_OUTLIER_SHIFT,
                KNOWN_VARIANCE + OUTLIER_EXTRA_VARIANCE);
        final double[] observations = ArrayUtils.addAll(nullTaxa, outliers);
        final double[] variances = new double[observations.length];
        Arrays.fill(variances, KNOWN_VARIANCE);
        return new BiasMixtureData(observations, variances);
    }

    @Test
    public void testConcreteScenario() {
        final BiasMixtureData data = new BiasMixtureData(new double[] {0.5, 0.5, -0.5, -0.5},
                new double[] {1, 1, 1, 1});
        final BiasMixtureParameters initial = new BiasMixtureParameters(0.8, 0.1, 0.1, 0, -0.2, 0.2, 0.1, 0.1);
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data, initial, defaultParams());
        final BiasMixtureParameters result = algo.runExpectationMaximization();

        Assert.assertTrue(algo.getIterations() <= MAX_ITERATIONS);
        Assert.assertTrue(algo.getIterations() > 0);
        Assert.assertTrue(result.getL1() <= 0 && result.getL2() >= 0);
        Assert.assertTrue(result.getKappa1() >= 0 && result.getKappa2() >= 0);
        Assert.assertTrue(algo.getErrorNorm() <= TOL || algo.getIterations() == MAX_ITERATIONS);
        Assert.assertFalse(result.hasUndefinedValues());
        /* the data and the initial state are symmetric around zero */
        Assert.assertEquals(result.getDelta(), 0.0, 1e-6);
        Assert.assertEquals(result.getPi1(), result.getPi2(), 1e-3);
        Assert.assertEquals(result.getL1(), -result.getL2(), 1e-3);
    }

    @Test
    public void testSignConstraintsAndNormalizationHoldAtEveryIteration() {
        final BiasMixtureData data = simulateData(1);
        final BiasMixtureParameters initial = new BiasMixtureInitializer(data).getInitializedParameters();
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data, initial, defaultParams().enableTrace());
        algo.runExpectationMaximization();

        final List<BiasMixtureParameters> trace = algo.getTrace();
        Assert.assertEquals(trace.size(), algo.getIterations() + 1);
        Assert.assertEquals(trace.get(0), initial);
        Assert.assertEquals(trace.get(trace.size() - 1), algo.getCurrentParameters());
        for (final BiasMixtureParameters params : trace) {
            Assert.assertTrue(params.satisfiesSignConstraints(), params.toString());
        }
        for (int i = 1; i < trace.size(); i++) {
            final BiasMixtureParameters params = trace.get(i);
            Assert.assertEquals(params.getPi0() + params.getPi1() + params.getPi2(), 1.0, 1e-10);
            Assert.assertTrue(params.distance(trace.get(i - 1)) >= 0);
        }
        final BiasMixtureResponsibilities resp = algo.getResponsibilities();
        for (int i = 0; i < resp.getNumTaxa(); i++) {
            Assert.assertEquals(resp.get(i, 0) + resp.get(i, 1) + resp.get(i, 2), 1.0, 1e-10);
        }
    }

    @Test
    public void testBiasRecoveryFromSimulatedData() {
        final BiasMixtureData data = simulateData(2);
        final BiasMixtureParameters initial = new BiasMixtureInitializer(data).getInitializedParameters();
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data, initial, defaultParams());
        final BiasMixtureParameters result = algo.runExpectationMaximization();

        Assert.assertEquals(result.getDelta(), TRUE_DELTA, 0.1);
        Assert.assertEquals(result.getPi2(), (double) NUM_OUTLIER_TAXA / (NUM_NULL_TAXA + NUM_OUTLIER_TAXA), 0.05);
        Assert.assertEquals(result.getL2(), TRUE_OUTLIER_SHIFT, 1.0);
    }

    /**
     * All taxa are consistent with the null component. After the first iteration the outlier components
     * collapse onto the null component (l = 0, kappa = 0), at which point the weights stop changing.
     */
    @Test
    public void testSingleComponentData() {
        final BiasMixtureData data = new BiasMixtureData(new double[] {0, 0, 0, 0}, new double[] {1, 1, 1, 1});
        final double third = 1.0 / 3;
        final BiasMixtureParameters initial = new BiasMixtureParameters(third, third, third, 0, -0.2, 0.2, 0.1, 0.1);
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data, initial, defaultParams());
        final BiasMixtureParameters result = algo.runExpectationMaximization();

        Assert.assertEquals(algo.getStatus(), BiasMixtureEMAlgorithm.EMAlgorithmStatus.SUCCESS_PARAMS_TOL);
        Assert.assertEquals(result.getDelta(), 0.0, TOL);
        Assert.assertEquals(result.getL1(), 0.0, TOL);
        Assert.assertEquals(result.getL2(), 0.0, TOL);
        Assert.assertEquals(result.getKappa1(), 0.0, TOL);
        Assert.assertEquals(result.getKappa2(), 0.0, TOL);
        Assert.assertTrue(result.getPi0() > result.getPi1());
        Assert.assertTrue(result.getPi0() > result.getPi2());
        Assert.assertEquals(result.getPi1(), result.getPi2(), 1e-12);
        Assert.assertEquals(result.getPi0() + result.getPi1() + result.getPi2(), 1.0, 1e-10);
    }

    @Test
    public void testFixedPoint() {
        final BiasMixtureData data = new BiasMixtureData(new double[] {0, 0, 0, 0}, new double[] {1, 1, 1, 1});
        final BiasMixtureParameters fixedPoint = new BiasMixtureParameters(0.5, 0.25, 0.25, 0, 0, 0, 0, 0);
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data, fixedPoint,
                defaultParams().setMaxIterations(1));
        final BiasMixtureParameters result = algo.runExpectationMaximization();
        Assert.assertEquals(algo.getIterations(), 1);
        Assert.assertTrue(algo.getErrorNorm() <= TOL);
        Assert.assertEquals(algo.getStatus(), BiasMixtureEMAlgorithm.EMAlgorithmStatus.SUCCESS_PARAMS_TOL);
        Assert.assertTrue(result.distance(fixedPoint) <= TOL);
    }

    @Test
    public void testIterationCap() {
        final BiasMixtureData data = simulateData(3);
        final BiasMixtureParameters initial = new BiasMixtureInitializer(data).getInitializedParameters();
        final int maxIterations = 2;
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data, initial,
                new BiasMixtureEMParams().setTolerance(1e-300).setMaxIterations(maxIterations));
        algo.runExpectationMaximization();
        Assert.assertTrue(algo.getIterations() <= maxIterations);
        if (algo.getStatus() == BiasMixtureEMAlgorithm.EMAlgorithmStatus.FAILURE_MAX_ITERS_REACHED) {
            Assert.assertEquals(algo.getIterations(), maxIterations);
            Assert.assertTrue(algo.getErrorNorm() > 1e-300);
        }
        Assert.assertNotNull(algo.getPreviousParameters());
    }

    @Test
    public void testZeroIterationsReturnsInitialParameters() {
        final BiasMixtureData data = simulateData(4);
        final BiasMixtureParameters initial = new BiasMixtureParameters(0.75, 0.125, 0.125, 0.3, -1, 1, 1, 1);
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data, initial,
                defaultParams().setMaxIterations(0));
        final BiasMixtureParameters result = algo.runExpectationMaximization();
        Assert.assertSame(result, initial);
        Assert.assertEquals(algo.getIterations(), 0);
        Assert.assertEquals(algo.getStatus(), BiasMixtureEMAlgorithm.EMAlgorithmStatus.SKIPPED_NO_ITERATIONS);
        Assert.assertNull(algo.getPreviousParameters());
        Assert.assertNull(algo.getResponsibilities());
    }

    @Test
    public void testNoTaxaGivesUndefinedParameters() {
        final BiasMixtureData data = new BiasMixtureData(new double[0], new double[0]);
        final BiasMixtureParameters initial = new BiasMixtureParameters(0.75, 0.125, 0.125, 0, -1, 1, 1, 1);
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data, initial, defaultParams());
        final BiasMixtureParameters result = algo.runExpectationMaximization();
        Assert.assertEquals(algo.getStatus(), BiasMixtureEMAlgorithm.EMAlgorithmStatus.FAILURE_UNDEFINED_PARAMETERS);
        Assert.assertFalse(algo.getStatus().isSuccess());
        Assert.assertTrue(result.hasUndefinedValues());
        Assert.assertTrue(Double.isNaN(result.getPi0()));
        Assert.assertTrue(Double.isNaN(result.getDelta()));
        Assert.assertEquals(algo.getIterations(), 1);
    }

    @Test
    public void testParallelOptionsGiveIdenticalEstimates() {
        final BiasMixtureData data = simulateData(5);
        final BiasMixtureParameters initial = new BiasMixtureInitializer(data).getInitializedParameters();
        final BiasMixtureParameters sequential = new BiasMixtureEMAlgorithm(data, initial, defaultParams())
                .runExpectationMaximization();
        final BiasMixtureParameters parallel = new BiasMixtureEMAlgorithm(data, initial, defaultParams()
                .enableParallelEStep().enableConcurrentKappaUpdates()).runExpectationMaximization();
        Assert.assertEquals(parallel, sequential);
    }

    @Test
    public void testRerunIsDeterministic() {
        final BiasMixtureData data = simulateData(6);
        final BiasMixtureParameters initial = new BiasMixtureInitializer(data).getInitializedParameters();
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data, initial,
                defaultParams().disableIterationLogging());
        final BiasMixtureParameters first = algo.runExpectationMaximization();
        final int firstIterations = algo.getIterations();
        final BiasMixtureParameters second = algo.runExpectationMaximization();
        Assert.assertEquals(second, first);
        Assert.assertEquals(algo.getIterations(), firstIterations);
    }

    @Test
    public void testBrentKappaSolverAgreesWithNelderMead() {
        final BiasMixtureData data = simulateData(7);
        final BiasMixtureParameters initial = new BiasMixtureInitializer(data).getInitializedParameters();
        final BiasMixtureParameters nelderMead = new BiasMixtureEMAlgorithm(data, initial, defaultParams())
                .runExpectationMaximization();
        final BiasMixtureParameters brent = new BiasMixtureEMAlgorithm(data, initial, defaultParams()
                .setKappaSolverType(BiasMixtureEMParams.KappaSolverType.KAPPA_VIA_BRENT)).runExpectationMaximization();
        Assert.assertTrue(brent.satisfiesSignConstraints());
        Assert.assertEquals(brent.getDelta(), nelderMead.getDelta(), 0.02);
    }

    @Test
    public void testStaticEstimate() {
        final BiasMixtureParameters initial = new BiasMixtureParameters(0.8, 0.1, 0.1, 0, -0.2, 0.2, 0.1, 0.1);
        final double[] observations = {0.5, 0.5, -0.5, -0.5};
        final double[] variances = {1, 1, 1, 1};
        final BiasMixtureParameters estimated = BiasMixtureEMAlgorithm.estimate(observations, variances, initial,
                TOL, MAX_ITERATIONS);
        final BiasMixtureParameters expected = new BiasMixtureEMAlgorithm(new BiasMixtureData(observations, variances),
                initial, defaultParams()).runExpectationMaximization();
        Assert.assertEquals(estimated, expected);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInitialParametersViolatingSignConstraints() {
        new BiasMixtureEMAlgorithm(simulateData(8), new BiasMixtureParameters(0.8, 0.1, 0.1, 0, 0.2, 0.2, 0.1, 0.1),
                defaultParams());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonFiniteInitialParameters() {
        new BiasMixtureEMAlgorithm(simulateData(8),
                new BiasMixtureParameters(0.8, 0.1, 0.1, Double.NaN, -0.2, 0.2, 0.1, 0.1), defaultParams());
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testMStepRequiresEStep() {
        final BiasMixtureData data = simulateData(9);
        new BiasMixtureEMAlgorithm(data, new BiasMixtureInitializer(data).getInitializedParameters(), defaultParams())
                .updateParameters();
    }

    @Test
    public void testLogLikelihoodIsReportedOncePerIteration() {
        final BiasMixtureData data = simulateData(10);
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data,
                new BiasMixtureInitializer(data).getInitializedParameters(), defaultParams());
        final SubroutineSignal eStep = algo.updateResponsibilities();
        Assert.assertFalse(eStep.contains(BiasMixtureEMAlgorithm.LOG_LIKELIHOOD_KEY));
        final SubroutineSignal mStep = algo.updateParameters();
        Assert.assertTrue(mStep.contains(BiasMixtureEMAlgorithm.LOG_LIKELIHOOD_KEY));
        Assert.assertEquals(mStep.getDouble(BiasMixtureEMAlgorithm.LOG_LIKELIHOOD_KEY), algo.getLogLikelihood());
    }

    @Test
    public void testLogLikelihoodIsNotComputedWithoutIterationLogging() {
        final BiasMixtureData data = simulateData(11);
        final BiasMixtureEMAlgorithm algo = new BiasMixtureEMAlgorithm(data,
                new BiasMixtureInitializer(data).getInitializedParameters(),
                defaultParams().disableIterationLogging());
        algo.updateResponsibilities();
        Assert.assertFalse(algo.updateParameters().contains(BiasMixtureEMAlgorithm.LOG_LIKELIHOOD_KEY));
    }
}
