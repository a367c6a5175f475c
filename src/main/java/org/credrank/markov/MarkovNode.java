package org.credrank.markov;

import org.credrank.core.address.NodeAddress;

import java.util.Objects;

/**
 * Node of the Markov process graph as a tagged variant.
 *
 * @param kind which gadget family the node belongs to.
 * @param address unique node address.
 * @param description human-readable description.
 * @param mint mint weight (organic nodes only, 0 otherwise).
 * @param intervalIndex interval of accumulator and epoch nodes, -1 otherwise.
 * @param owner owning participant of epoch nodes, {@code null} otherwise.
 * @param timestampMs creation time of organic nodes, {@code null} for gadgets and timeless nodes.
 */
public record MarkovNode(
        Kind kind,
        NodeAddress address,
        String description,
        double mint,
        int intervalIndex,
        ParticipantId owner,
        Long timestampMs
) {
    public MarkovNode {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(description, "description");
        if (!Double.isFinite(mint) || mint < 0.0d) {
            throw new IllegalArgumentException("mint must be finite and >= 0, got " + mint);
        }
        if ((kind == Kind.EPOCH) != (owner != null)) {
            throw new IllegalArgumentException("owner must be set exactly for epoch nodes: " + address);
        }
        if (kind != Kind.ORGANIC && (mint != 0.0d || timestampMs != null)) {
            throw new IllegalArgumentException("only organic nodes carry mint and timestamp: " + address);
        }
    }

    public static MarkovNode seed() {
        return new MarkovNode(Kind.SEED, Gadgets.SEED, "seed", 0.0d, -1, null, null);
    }

    public static MarkovNode accumulator(int intervalIndex, long epochStartMs) {
        return new MarkovNode(
                Kind.ACCUMULATOR,
                Gadgets.accumulator(epochStartMs),
                "accumulator for epoch starting " + epochStartMs,
                0.0d,
                intervalIndex,
                null,
                null
        );
    }

    public static MarkovNode epoch(Participant participant, int intervalIndex, long epochStartMs) {
        return new MarkovNode(
                Kind.EPOCH,
                Gadgets.epoch(participant.id(), epochStartMs),
                participant.description() + " (epoch starting " + epochStartMs + ")",
                0.0d,
                intervalIndex,
                participant.id(),
                null
        );
    }

    public static MarkovNode organic(NodeAddress address, String description, double mint, Long timestampMs) {
        return new MarkovNode(Kind.ORGANIC, address, description, mint, -1, null, timestampMs);
    }

    /**
     * Gadget family of a node.
     */
    public enum Kind {
        SEED,
        ACCUMULATOR,
        EPOCH,
        ORGANIC
    }
}
