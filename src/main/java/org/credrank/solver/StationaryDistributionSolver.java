package org.credrank.solver;

import lombok.extern.slf4j.Slf4j;
import org.credrank.core.CredRankException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Damped power iteration for the stationary distribution of a sparse chain.
 *
 * <p>Starting from the uniform vector over nodes that have incoming transitions
 * (nodes without any are transient and stay at exactly 0), each step computes {@code y = x * M}. When
 * {@code max|y - x|} drops below the threshold the current {@code x} is returned;
 * otherwise {@code x} moves to {@code (1 - d) * x + d * y}. Damping keeps the fixed
 * point and removes oscillation on periodic chains. Results are bit-for-bit
 * reproducible for the same chain and options.</p>
 */
@Slf4j
public final class StationaryDistributionSolver {

    private StationaryDistributionSolver() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Solves with {@link SolverOptions#defaults()}.
     */
    public static StationaryDistribution solve(SparseMarkovChain chain) {
        return solve(chain, SolverOptions.defaults());
    }

    /**
     * @throws CredRankException {@code NONCONVERGENT} when {@code maxIterations} steps do not converge.
     */
    public static StationaryDistribution solve(SparseMarkovChain chain, SolverOptions options) {
        Objects.requireNonNull(chain, "chain");
        Objects.requireNonNull(options, "options");
        int n = chain.nodeCount();
        if (n == 0) {
            return new StationaryDistribution(new double[0], 0.0d, 0);
        }
        double[] x = initialVector(chain);
        double[] y = new double[n];
        double d = options.damping();
        double delta = Double.POSITIVE_INFINITY;
        for (int iteration = 1; iteration <= options.maxIterations(); iteration++) {
            chain.multiply(x, y);
            delta = 0.0d;
            for (int i = 0; i < n; i++) {
                delta = Math.max(delta, Math.abs(y[i] - x[i]));
            }
            if (delta < options.convergenceThreshold()) {
                log.debug("stationary distribution converged after {} iterations (delta={})", iteration, delta);
                return new StationaryDistribution(x, delta, iteration);
            }
            for (int i = 0; i < n; i++) {
                x[i] = (1.0d - d) * x[i] + d * y[i];
            }
            if (log.isTraceEnabled()) {
                log.trace("iteration {} delta={}", iteration, delta);
            }
        }
        throw new CredRankException(
                CredRankException.REASON_NONCONVERGENT,
                "stationary distribution did not converge within " + options.maxIterations()
                        + " iterations (last delta=" + delta + ", threshold=" + options.convergenceThreshold() + ")"
        );
    }

    private static double[] initialVector(SparseMarkovChain chain) {
        int n = chain.nodeCount();
        int reachable = 0;
        for (int i = 0; i < n; i++) {
            if (chain.inDegree(i) > 0) {
                reachable++;
            }
        }
        double[] x = new double[n];
        if (reachable == 0) {
            Arrays.fill(x, 1.0d / n);
            return x;
        }
        double share = 1.0d / reachable;
        for (int i = 0; i < n; i++) {
            if (chain.inDegree(i) > 0) {
                x[i] = share;
            }
        }
        return x;
    }
}
