package org.credrank.cred;

import org.credrank.core.CredRankException;
import org.credrank.core.address.NodeAddress;

import java.util.List;
import java.util.Objects;

/**
 * Extra Cred minted to {@code recipient}, proportional to the Cred minted by the graph in each interval.
 *
 * <p>Periods must be in chronological order with finite, non-negative weights.</p>
 */
public record DependencyMintPolicy(NodeAddress recipient, List<DependencyMintPeriod> periods) {
    public DependencyMintPolicy {
        Objects.requireNonNull(recipient, "recipient");
        periods = List.copyOf(Objects.requireNonNull(periods, "periods"));
        long previous = Long.MIN_VALUE;
        for (DependencyMintPeriod period : periods) {
            if (period.startMs() < previous) {
                throw new CredRankException(
                        CredRankException.REASON_POLICY_ERROR,
                        "mint periods for " + recipient + " out of order: " + previous + " > " + period.startMs()
                );
            }
            previous = period.startMs();
            if (!Double.isFinite(period.weight()) || period.weight() < 0.0d) {
                throw new CredRankException(
                        CredRankException.REASON_POLICY_ERROR,
                        "invalid mint weight for " + recipient + ": " + period.weight()
                );
            }
        }
    }

    /**
     * Weight in effect for each interval start: the latest period starting at or before it, else 0.
     */
    public double[] weightsForIntervals(long[] intervalStarts) {
        double[] weights = new double[intervalStarts.length];
        int current = -1;
        double weight = 0.0d;
        for (int k = 0; k < intervalStarts.length; k++) {
            while (current < periods.size() - 1 && periods.get(current + 1).startMs() <= intervalStarts[k]) {
                current++;
                weight = periods.get(current).weight();
            }
            weights[k] = weight;
        }
        return weights;
    }
}
