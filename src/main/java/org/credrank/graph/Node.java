package org.credrank.graph;

import org.credrank.core.address.NodeAddress;

import java.util.Objects;

/**
 * Contribution-graph node.
 *
 * @param address unique node address.
 * @param description human-readable description.
 * @param timestampMs creation time, or {@code null} for timeless nodes.
 */
public record Node(NodeAddress address, String description, Long timestampMs) {
    public Node {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(description, "description");
    }

    /**
     * Creates a timeless node.
     */
    public static Node timeless(NodeAddress address, String description) {
        return new Node(address, description, null);
    }

    public boolean isTimeless() {
        return timestampMs == null;
    }
}
