package org.credrank.solver;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import org.credrank.core.CredRankException;

/**
 * Convergence settings of the stationary-distribution solver.
 */
@Value
@Accessors(fluent = true)
public class SolverOptions {
    static final String PROP_CONVERGENCE_THRESHOLD = "credrank.solver.convergenceThreshold";
    static final String PROP_MAX_ITERATIONS = "credrank.solver.maxIterations";
    static final String PROP_DAMPING = "credrank.solver.damping";

    public static final double DEFAULT_CONVERGENCE_THRESHOLD = 1e-7d;
    public static final int DEFAULT_MAX_ITERATIONS = 255;
    public static final double DEFAULT_DAMPING = 0.5d;

    /** Max-norm step size below which the distribution counts as stationary. */
    double convergenceThreshold;
    /** Iterations allowed before failing with {@code NONCONVERGENT}. */
    int maxIterations;
    /** Share of the new iterate mixed into the old one, in {@code (0, 1]}. */
    double damping;

    /**
     * @throws CredRankException {@code PARAMETER_ERROR} for a non-positive threshold or
     *                           iteration count, or damping outside {@code (0, 1]}.
     */
    @Builder
    public SolverOptions(double convergenceThreshold, int maxIterations, double damping) {
        if (!Double.isFinite(convergenceThreshold) || convergenceThreshold <= 0.0d) {
            throw parameterError("convergenceThreshold must be > 0, got " + convergenceThreshold);
        }
        if (maxIterations <= 0) {
            throw parameterError("maxIterations must be > 0, got " + maxIterations);
        }
        if (!Double.isFinite(damping) || damping <= 0.0d || damping > 1.0d) {
            throw parameterError("damping must be in (0, 1], got " + damping);
        }
        this.convergenceThreshold = convergenceThreshold;
        this.maxIterations = maxIterations;
        this.damping = damping;
    }

    /**
     * Loads options from {@code credrank.solver.*} system properties, falling back to the defaults.
     */
    public static SolverOptions defaults() {
        return new SolverOptions(
                readDouble(PROP_CONVERGENCE_THRESHOLD, DEFAULT_CONVERGENCE_THRESHOLD),
                (int) readDouble(PROP_MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS),
                readDouble(PROP_DAMPING, DEFAULT_DAMPING)
        );
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new CredRankException(
                    CredRankException.REASON_PARAMETER_ERROR,
                    "system property " + property + " is not a number: " + raw,
                    ex
            );
        }
    }

    private static CredRankException parameterError(String message) {
        return new CredRankException(CredRankException.REASON_PARAMETER_ERROR, message);
    }
}
