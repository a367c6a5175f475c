package org.credrank.graph;

import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;

import java.util.Objects;

/**
 * Directed contribution-graph edge. Self-loops and parallel edges are allowed.
 */
public record Edge(EdgeAddress address, NodeAddress src, NodeAddress dst, long timestampMs) {
    public Edge {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(src, "src");
        Objects.requireNonNull(dst, "dst");
    }
}
