package org.credrank.solver;

import java.util.Arrays;
import java.util.Objects;

/**
 * Sparse row-stochastic chain stored by destination column.
 *
 * <p>Column {@code j} holds the entries {@code sources[inStart[j] .. inStart[j + 1])}
 * with their transition probabilities. Entry order is fixed at construction, so
 * every multiplication sums in the same order.</p>
 */
public final class SparseMarkovChain {
    private final int nodeCount;
    private final int[] inStart;
    private final int[] sources;
    private final double[] probabilities;

    /**
     * Creates a chain over validated CSR-by-destination arrays. Arrays are not copied.
     *
     * @throws IllegalArgumentException when offsets are not monotone or an entry is out of range.
     */
    public SparseMarkovChain(int[] inStart, int[] sources, double[] probabilities) {
        this.inStart = Objects.requireNonNull(inStart, "inStart");
        this.sources = Objects.requireNonNull(sources, "sources");
        this.probabilities = Objects.requireNonNull(probabilities, "probabilities");
        if (inStart.length == 0 || inStart[0] != 0) {
            throw new IllegalArgumentException("inStart must start with 0");
        }
        if (sources.length != probabilities.length || inStart[inStart.length - 1] != sources.length) {
            throw new IllegalArgumentException("entry arrays do not match column offsets");
        }
        this.nodeCount = inStart.length - 1;
        for (int j = 0; j < nodeCount; j++) {
            if (inStart[j] > inStart[j + 1]) {
                throw new IllegalArgumentException("column offsets are not monotone at " + j);
            }
        }
        for (int e = 0; e < sources.length; e++) {
            if (sources[e] < 0 || sources[e] >= nodeCount) {
                throw new IllegalArgumentException("entry " + e + " has source out of range: " + sources[e]);
            }
            if (!Double.isFinite(probabilities[e]) || probabilities[e] < 0.0d) {
                throw new IllegalArgumentException("entry " + e + " has invalid probability: " + probabilities[e]);
            }
        }
    }

    /**
     * Builds a chain from a dense row-stochastic matrix {@code m[src][dst]}. Zero entries are skipped.
     */
    public static SparseMarkovChain fromTransitionMatrix(double[][] matrix) {
        Objects.requireNonNull(matrix, "matrix");
        int n = matrix.length;
        int nonZero = 0;
        for (double[] row : matrix) {
            if (Objects.requireNonNull(row, "row").length != n) {
                throw new IllegalArgumentException("transition matrix must be square");
            }
            for (double p : row) {
                if (p != 0.0d) {
                    nonZero++;
                }
            }
        }
        int[] inStart = new int[n + 1];
        int[] sources = new int[nonZero];
        double[] probabilities = new double[nonZero];
        int cursor = 0;
        for (int dst = 0; dst < n; dst++) {
            inStart[dst] = cursor;
            for (int src = 0; src < n; src++) {
                double p = matrix[src][dst];
                if (p != 0.0d) {
                    sources[cursor] = src;
                    probabilities[cursor] = p;
                    cursor++;
                }
            }
        }
        inStart[n] = cursor;
        return new SparseMarkovChain(inStart, sources, probabilities);
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int entryCount() {
        return sources.length;
    }

    /**
     * Number of stored transitions into {@code node}.
     */
    public int inDegree(int node) {
        return inStart[node + 1] - inStart[node];
    }

    /**
     * Computes {@code out = pi * M}.
     */
    public void multiply(double[] pi, double[] out) {
        if (pi.length != nodeCount || out.length != nodeCount) {
            throw new IllegalArgumentException(
                    "vector length must be " + nodeCount + ", got " + pi.length + "/" + out.length
            );
        }
        for (int dst = 0; dst < nodeCount; dst++) {
            double sum = 0.0d;
            for (int e = inStart[dst]; e < inStart[dst + 1]; e++) {
                sum += pi[sources[e]] * probabilities[e];
            }
            out[dst] = sum;
        }
    }

    /**
     * Sum of outgoing probabilities of every source node.
     */
    public double[] rowSums() {
        double[] sums = new double[nodeCount];
        for (int e = 0; e < sources.length; e++) {
            sums[sources[e]] += probabilities[e];
        }
        return sums;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SparseMarkovChain other)) {
            return false;
        }
        return Arrays.equals(inStart, other.inStart)
                && Arrays.equals(sources, other.sources)
                && Arrays.equals(probabilities, other.probabilities);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(inStart);
        result = 31 * result + Arrays.hashCode(sources);
        return 31 * result + Arrays.hashCode(probabilities);
    }
}
