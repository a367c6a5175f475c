package org.credrank.markov;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import org.credrank.core.CredRankException;

/**
 * Transition probabilities baked into the Markov process graph.
 *
 * <ul>
 * <li>{@code alpha}: radiation from every non-seed node back to the seed.</li>
 * <li>{@code beta}: payout from an epoch node to its accumulator.</li>
 * <li>{@code gammaForward}/{@code gammaBackward}: webbing to the next/previous epoch.</li>
 * </ul>
 */
@Value
@Accessors(fluent = true)
public class Parameters {
    static final String PROP_ALPHA = "credrank.parameters.alpha";
    static final String PROP_BETA = "credrank.parameters.beta";
    static final String PROP_GAMMA_FORWARD = "credrank.parameters.gammaForward";
    static final String PROP_GAMMA_BACKWARD = "credrank.parameters.gammaBackward";

    public static final double DEFAULT_ALPHA = 0.2d;
    public static final double DEFAULT_BETA = 0.4d;
    public static final double DEFAULT_GAMMA_FORWARD = 0.1d;
    public static final double DEFAULT_GAMMA_BACKWARD = 0.1d;

    private static final double SUM_TOLERANCE = 1e-12d;

    double alpha;
    double beta;
    double gammaForward;
    double gammaBackward;

    /**
     * Creates validated parameters.
     *
     * @throws CredRankException {@code PARAMETER_ERROR} when a probability is out of range,
     *                           alpha is not positive, or the epoch-node total exceeds 1.
     */
    @Builder
    public Parameters(double alpha, double beta, double gammaForward, double gammaBackward) {
        this.alpha = requireProbability(alpha, "alpha");
        this.beta = requireProbability(beta, "beta");
        this.gammaForward = requireProbability(gammaForward, "gammaForward");
        this.gammaBackward = requireProbability(gammaBackward, "gammaBackward");
        if (alpha <= 0.0d) {
            throw new CredRankException(CredRankException.REASON_PARAMETER_ERROR, "alpha must be > 0, got " + alpha);
        }
        double total = alpha + beta + gammaForward + gammaBackward;
        if (total > 1.0d + SUM_TOLERANCE) {
            throw new CredRankException(
                    CredRankException.REASON_PARAMETER_ERROR,
                    "alpha + beta + gammaForward + gammaBackward must be <= 1, got " + total
            );
        }
    }

    /**
     * Default parameters, overridable through {@code credrank.parameters.*} system properties.
     */
    public static Parameters defaults() {
        return new Parameters(
                readProbability(PROP_ALPHA, DEFAULT_ALPHA),
                readProbability(PROP_BETA, DEFAULT_BETA),
                readProbability(PROP_GAMMA_FORWARD, DEFAULT_GAMMA_FORWARD),
                readProbability(PROP_GAMMA_BACKWARD, DEFAULT_GAMMA_BACKWARD)
        );
    }

    /**
     * Probability mass left for contribution edges out of an epoch node, never negative.
     */
    public double epochContributionBudget() {
        return Math.max(0.0d, 1.0d - (alpha + beta + gammaForward + gammaBackward));
    }

    private static double requireProbability(double value, String fieldName) {
        if (!Double.isFinite(value) || value < 0.0d || value > 1.0d) {
            throw new CredRankException(
                    CredRankException.REASON_PARAMETER_ERROR,
                    fieldName + " must be a probability in [0, 1], got " + value
            );
        }
        return value;
    }

    private static double readProbability(String property, double fallback) {
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
}
