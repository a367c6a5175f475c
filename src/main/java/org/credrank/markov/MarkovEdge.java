package org.credrank.markov;

import org.credrank.core.address.EdgeAddress;

import java.util.Objects;

/**
 * Edge of the Markov process graph as a tagged variant.
 *
 * <p>{@code src} and {@code dst} are node indices in the owning graph's node
 * order. {@code address} is the contribution edge address for organic edges and
 * the gadget address otherwise; together with {@code reversed} it is unique.</p>
 */
public record MarkovEdge(
        Kind kind,
        EdgeAddress address,
        boolean reversed,
        int src,
        int dst,
        double transitionProbability
) {
    public MarkovEdge {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(address, "address");
        if (src < 0 || dst < 0) {
            throw new IllegalArgumentException("edge endpoints must be >= 0: " + src + " -> " + dst);
        }
        if (!Double.isFinite(transitionProbability)) {
            throw new IllegalArgumentException("transition probability must be finite: " + address);
        }
    }

    /**
     * Unique key of this edge within its graph.
     */
    public EdgeAddress markovAddress() {
        return Gadgets.markovAddress(address, reversed);
    }

    /**
     * Gadget family of an edge.
     */
    public enum Kind {
        MINT,
        ORGANIC,
        PAYOUT,
        WEBBING_FORWARD,
        WEBBING_BACKWARD,
        ATTRIBUTION,
        RADIATION
    }
}
