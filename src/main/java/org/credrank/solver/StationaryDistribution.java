package org.credrank.solver;

/**
 * Result of a stationary-distribution solve.
 *
 * @param pi probability vector, one entry per chain node.
 * @param convergenceDelta max-norm distance between the last two iterates.
 * @param iterations number of multiplications performed.
 */
public record StationaryDistribution(double[] pi, double convergenceDelta, int iterations) {
    public StationaryDistribution {
        pi = pi.clone();
    }

    @Override
    public double[] pi() {
        return pi.clone();
    }

    public double probability(int node) {
        return pi[node];
    }

    public int size() {
        return pi.length;
    }
}
