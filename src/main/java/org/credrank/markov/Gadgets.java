package org.credrank.markov;

import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;

/**
 * Address constructors for the synthetic nodes and edges of the Markov process graph.
 *
 * <p>All gadget node addresses live under {@link #NODE_PREFIX}; contribution
 * graphs may not use that namespace.</p>
 */
public final class Gadgets {
    public static final NodeAddress NODE_PREFIX = NodeAddress.of("sourcecred", "core", "gadget");
    public static final EdgeAddress EDGE_PREFIX = EdgeAddress.of("sourcecred", "core", "gadget");

    public static final NodeAddress SEED = NODE_PREFIX.append("SEED");
    public static final NodeAddress ACCUMULATOR_PREFIX = NODE_PREFIX.append("ACCUMULATOR");
    public static final NodeAddress EPOCH_PREFIX = NODE_PREFIX.append("EPOCH");

    public static final EdgeAddress MINT_PREFIX = EDGE_PREFIX.append("SEED_MINT");
    public static final EdgeAddress RADIATION_PREFIX = EDGE_PREFIX.append("RADIATION");
    public static final EdgeAddress PAYOUT_PREFIX = EDGE_PREFIX.append("PAYOUT");
    public static final EdgeAddress WEBBING_PREFIX = EDGE_PREFIX.append("EPOCH_WEBBING");
    public static final EdgeAddress ATTRIBUTION_PREFIX = EDGE_PREFIX.append("ATTRIBUTION");

    static final String FORWARD = "F";
    static final String BACKWARD = "B";

    private Gadgets() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static NodeAddress accumulator(long epochStartMs) {
        return ACCUMULATOR_PREFIX.append(Long.toString(epochStartMs));
    }

    public static NodeAddress epoch(ParticipantId owner, long epochStartMs) {
        return EPOCH_PREFIX.append(owner.toString(), Long.toString(epochStartMs));
    }

    public static EdgeAddress mint(NodeAddress target) {
        return MINT_PREFIX.append(target.toParts());
    }

    public static EdgeAddress radiation(NodeAddress source) {
        return RADIATION_PREFIX.append(source.toParts());
    }

    public static EdgeAddress payout(ParticipantId owner, long epochStartMs) {
        return PAYOUT_PREFIX.append(Long.toString(epochStartMs), owner.toString());
    }

    public static EdgeAddress webbing(ParticipantId owner, long lastStartMs, long thisStartMs) {
        return WEBBING_PREFIX.append(Long.toString(lastStartMs), Long.toString(thisStartMs), owner.toString());
    }

    public static EdgeAddress attribution(long epochStartMs, ParticipantId from, ParticipantId to) {
        return ATTRIBUTION_PREFIX.append(Long.toString(epochStartMs), from.toString(), to.toString());
    }

    /**
     * Unique key of a Markov edge: direction marker followed by the edge address parts.
     */
    public static EdgeAddress markovAddress(EdgeAddress address, boolean reversed) {
        return EdgeAddress.of(reversed ? BACKWARD : FORWARD).append(address.toParts());
    }
}
