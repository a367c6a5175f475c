package org.credrank.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("SparseMarkovChain Tests")
class SparseMarkovChainTest {

    private static final double[][] TWO_STATE = {
            {0.5d, 0.5d},
            {0.2d, 0.8d}
    };

    @Test
    @DisplayName("Dense matrix conversion skips zero entries")
    void testFromTransitionMatrix() {
        SparseMarkovChain chain = SparseMarkovChain.fromTransitionMatrix(new double[][]{
                {0.0d, 1.0d, 0.0d},
                {0.5d, 0.0d, 0.5d},
                {0.0d, 1.0d, 0.0d}
        });
        assertEquals(3, chain.nodeCount());
        assertEquals(4, chain.entryCount());
        assertEquals(1, chain.inDegree(0));
        assertEquals(2, chain.inDegree(1));
        assertArrayEquals(new double[]{1.0d, 1.0d, 1.0d}, chain.rowSums(), 1e-15);
    }

    @Test
    @DisplayName("multiply computes pi * M")
    void testMultiply() {
        SparseMarkovChain chain = SparseMarkovChain.fromTransitionMatrix(TWO_STATE);
        double[] out = new double[2];
        chain.multiply(new double[]{1.0d, 0.0d}, out);
        assertArrayEquals(new double[]{0.5d, 0.5d}, out, 1e-15);
        chain.multiply(new double[]{0.5d, 0.5d}, out);
        assertArrayEquals(new double[]{0.35d, 0.65d}, out, 1e-15);
        assertThrows(IllegalArgumentException.class, () -> chain.multiply(new double[3], new double[2]));
    }

    @Test
    @DisplayName("Malformed column arrays are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SparseMarkovChain(new int[0], new int[0], new double[0]));
        assertThrows(IllegalArgumentException.class, () -> new SparseMarkovChain(new int[]{1, 1}, new int[]{0}, new double[]{1.0d}));
        assertThrows(IllegalArgumentException.class, () -> new SparseMarkovChain(new int[]{0, 1}, new int[]{1}, new double[]{1.0d}));
        assertThrows(IllegalArgumentException.class, () -> new SparseMarkovChain(new int[]{0, 1}, new int[]{0}, new double[]{-0.5d}));
        assertThrows(IllegalArgumentException.class, () -> new SparseMarkovChain(new int[]{0, 2, 1}, new int[]{0}, new double[]{1.0d}));
        assertThrows(IllegalArgumentException.class, () -> SparseMarkovChain.fromTransitionMatrix(new double[][]{{1.0d, 0.0d}}));
    }

    @Test
    @DisplayName("Equality compares structure and probabilities")
    void testEquality() {
        assertEquals(SparseMarkovChain.fromTransitionMatrix(TWO_STATE), SparseMarkovChain.fromTransitionMatrix(TWO_STATE));
        assertEquals(
                SparseMarkovChain.fromTransitionMatrix(TWO_STATE).hashCode(),
                SparseMarkovChain.fromTransitionMatrix(TWO_STATE).hashCode()
        );
        assertNotEquals(
                SparseMarkovChain.fromTransitionMatrix(TWO_STATE),
                SparseMarkovChain.fromTransitionMatrix(new double[][]{{0.4d, 0.6d}, {0.2d, 0.8d}})
        );
    }
}
