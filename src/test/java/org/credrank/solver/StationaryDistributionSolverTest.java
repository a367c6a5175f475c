package org.credrank.solver;

import org.credrank.core.CredRankException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("StationaryDistributionSolver Tests")
class StationaryDistributionSolverTest {

    private static final SolverOptions OPTIONS = SolverOptions.builder()
            .convergenceThreshold(1e-10d)
            .maxIterations(1_000)
            .damping(0.5d)
            .build();

    /** 0 -> 1, 1 -> {0, 2}, 2 -> 1: period 2, stationary (1/4, 1/2, 1/4). */
    private static SparseMarkovChain periodicChain() {
        return SparseMarkovChain.fromTransitionMatrix(new double[][]{
                {0.0d, 1.0d, 0.0d},
                {0.5d, 0.0d, 0.5d},
                {0.0d, 1.0d, 0.0d}
        });
    }

    @Test
    @Timeout(5)
    @DisplayName("Two-state chain converges to its analytic distribution")
    void testKnownDistribution() {
        SparseMarkovChain chain = SparseMarkovChain.fromTransitionMatrix(new double[][]{
                {0.5d, 0.5d},
                {0.2d, 0.8d}
        });
        StationaryDistribution distribution = StationaryDistributionSolver.solve(chain, OPTIONS);
        assertArrayEquals(new double[]{2.0d / 7.0d, 5.0d / 7.0d}, distribution.pi(), 1e-8);
        assertTrue(distribution.convergenceDelta() < OPTIONS.convergenceThreshold());
        assertTrue(distribution.iterations() > 1);
    }

    @Test
    @Timeout(5)
    @DisplayName("Damping makes periodic chains converge")
    void testPeriodicChainConverges() {
        StationaryDistribution distribution = StationaryDistributionSolver.solve(periodicChain(), OPTIONS);
        assertArrayEquals(new double[]{0.25d, 0.5d, 0.25d}, distribution.pi(), 1e-8);
        assertEquals(1.0d, distribution.probability(0) + distribution.probability(1) + distribution.probability(2), 1e-12);
    }

    @Test
    @Timeout(5)
    @DisplayName("Undamped iteration oscillates on periodic chains")
    void testUndampedPeriodicChainFails() {
        SolverOptions undamped = SolverOptions.builder()
                .convergenceThreshold(1e-7d)
                .maxIterations(100)
                .damping(1.0d)
                .build();
        CredRankException ex = assertThrows(
                CredRankException.class,
                () -> StationaryDistributionSolver.solve(periodicChain(), undamped)
        );
        assertEquals(CredRankException.REASON_NONCONVERGENT, ex.getReasonCode());
    }

    @Test
    @DisplayName("Iteration cap raises NONCONVERGENT")
    void testIterationCap() {
        SolverOptions oneStep = SolverOptions.builder()
                .convergenceThreshold(1e-7d)
                .maxIterations(1)
                .damping(0.5d)
                .build();
        SparseMarkovChain chain = SparseMarkovChain.fromTransitionMatrix(new double[][]{
                {0.5d, 0.5d},
                {0.2d, 0.8d}
        });
        CredRankException ex = assertThrows(CredRankException.class, () -> StationaryDistributionSolver.solve(chain, oneStep));
        assertEquals(CredRankException.REASON_NONCONVERGENT, ex.getReasonCode());
    }

    @Test
    @DisplayName("Uniform start on a doubly stochastic chain converges immediately")
    void testImmediateConvergence() {
        StationaryDistribution distribution = StationaryDistributionSolver.solve(
                SparseMarkovChain.fromTransitionMatrix(new double[][]{{0.0d, 1.0d}, {1.0d, 0.0d}}),
                OPTIONS
        );
        assertEquals(1, distribution.iterations());
        assertArrayEquals(new double[]{0.5d, 0.5d}, distribution.pi());
    }

    @Test
    @DisplayName("Nodes without incoming transitions end at exactly zero")
    void testTransientNodesAreZero() {
        StationaryDistribution distribution = StationaryDistributionSolver.solve(
                SparseMarkovChain.fromTransitionMatrix(new double[][]{
                        {0.0d, 1.0d, 0.0d},
                        {0.0d, 1.0d, 0.0d},
                        {0.0d, 1.0d, 0.0d}
                }),
                OPTIONS
        );
        assertEquals(0.0d, distribution.probability(0));
        assertEquals(1.0d, distribution.probability(1));
        assertEquals(0.0d, distribution.probability(2));
    }

    @Test
    @DisplayName("Empty chain yields an empty distribution")
    void testEmptyChain() {
        StationaryDistribution distribution = StationaryDistributionSolver.solve(
                SparseMarkovChain.fromTransitionMatrix(new double[0][]),
                OPTIONS
        );
        assertEquals(0, distribution.size());
        assertEquals(0, distribution.iterations());
    }

    @Test
    @DisplayName("Solving twice gives bit-identical results")
    void testDeterminism() {
        double[] first = StationaryDistributionSolver.solve(periodicChain(), OPTIONS).pi();
        double[] second = StationaryDistributionSolver.solve(periodicChain(), OPTIONS).pi();
        assertArrayEquals(first, second);
    }

    @Test
    @DisplayName("Returned vectors are defensive copies")
    void testDistributionCopies() {
        StationaryDistribution distribution = new StationaryDistribution(new double[]{0.25d, 0.75d}, 0.0d, 3);
        distribution.pi()[0] = 1.0d;
        assertEquals(0.25d, distribution.probability(0));
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, 10, 0.5",
            "-1e-7, 10, 0.5",
            "1e-7, 0, 0.5",
            "1e-7, 10, 0.0",
            "1e-7, 10, 1.5",
            "NaN, 10, 0.5"
    })
    @DisplayName("Invalid solver options are rejected")
    void testOptionValidation(double threshold, int maxIterations, double damping) {
        CredRankException ex = assertThrows(
                CredRankException.class,
                () -> new SolverOptions(threshold, maxIterations, damping)
        );
        assertEquals(CredRankException.REASON_PARAMETER_ERROR, ex.getReasonCode());
    }

    @Test
    @DisplayName("Defaults honor system property overrides")
    void testDefaultsFromSystemProperties() {
        assertEquals(SolverOptions.DEFAULT_MAX_ITERATIONS, SolverOptions.defaults().maxIterations());
        System.setProperty(SolverOptions.PROP_MAX_ITERATIONS, "17");
        try {
            assertEquals(17, SolverOptions.defaults().maxIterations());
            assertEquals(SolverOptions.DEFAULT_DAMPING, SolverOptions.defaults().damping());
            System.setProperty(SolverOptions.PROP_MAX_ITERATIONS, "many");
            CredRankException ex = assertThrows(CredRankException.class, SolverOptions::defaults);
            assertEquals(CredRankException.REASON_PARAMETER_ERROR, ex.getReasonCode());
        } finally {
            System.clearProperty(SolverOptions.PROP_MAX_ITERATIONS);
        }
    }
}
