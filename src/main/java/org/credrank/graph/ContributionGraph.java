package org.credrank.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.credrank.core.CredRankException;
import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only typed directed multigraph of contributions.
 *
 * <p>Storage is an arena: nodes and edges live in insertion-ordered lists and
 * are cross-referenced by dense int indices. Address lookups go through
 * fastutil open-hash maps that return {@code -1} for unknown keys.</p>
 *
 * <p>Once {@link #seal()} has been called the graph rejects further mutation and
 * is safe for concurrent reads.</p>
 */
public final class ContributionGraph {
    private static final int MISSING = -1;

    private final ArrayList<Node> nodes = new ArrayList<>();
    private final ArrayList<Edge> edges = new ArrayList<>();
    private final Object2IntOpenHashMap<NodeAddress> nodeIndex = new Object2IntOpenHashMap<>();
    private final Object2IntOpenHashMap<EdgeAddress> edgeIndex = new Object2IntOpenHashMap<>();
    private final ArrayList<IntArrayList> outAdjacency = new ArrayList<>();
    private final ArrayList<IntArrayList> inAdjacency = new ArrayList<>();
    private boolean sealed;

    public ContributionGraph() {
        nodeIndex.defaultReturnValue(MISSING);
        edgeIndex.defaultReturnValue(MISSING);
    }

    /**
     * Adds a node. Re-adding an identical node is a no-op.
     *
     * @throws CredRankException {@code DUPLICATE_ADDRESS} when the address holds a different node.
     */
    public ContributionGraph addNode(Node node) {
        Objects.requireNonNull(node, "node");
        ensureMutable();
        int existing = nodeIndex.getInt(node.address());
        if (existing != MISSING) {
            if (!nodes.get(existing).equals(node)) {
                throw new CredRankException(
                        CredRankException.REASON_DUPLICATE_ADDRESS,
                        "node address already holds different content: " + node.address()
                );
            }
            return this;
        }
        nodeIndex.put(node.address(), nodes.size());
        nodes.add(node);
        outAdjacency.add(new IntArrayList());
        inAdjacency.add(new IntArrayList());
        return this;
    }

    /**
     * Adds an edge between two existing nodes. Re-adding an identical edge is a no-op.
     *
     * @throws CredRankException {@code DANGLING_EDGE} when an endpoint is missing,
     *                           {@code DUPLICATE_ADDRESS} when the address holds a different edge.
     */
    public ContributionGraph addEdge(Edge edge) {
        Objects.requireNonNull(edge, "edge");
        ensureMutable();
        int existing = edgeIndex.getInt(edge.address());
        if (existing != MISSING) {
            if (!edges.get(existing).equals(edge)) {
                throw new CredRankException(
                        CredRankException.REASON_DUPLICATE_ADDRESS,
                        "edge address already holds different content: " + edge.address()
                );
            }
            return this;
        }
        int src = nodeIndex.getInt(edge.src());
        int dst = nodeIndex.getInt(edge.dst());
        if (src == MISSING || dst == MISSING) {
            throw new CredRankException(
                    CredRankException.REASON_DANGLING_EDGE,
                    "edge " + edge.address() + " references missing "
                            + (src == MISSING ? "src " + edge.src() : "dst " + edge.dst())
            );
        }
        int index = edges.size();
        edgeIndex.put(edge.address(), index);
        edges.add(edge);
        outAdjacency.get(src).add(index);
        inAdjacency.get(dst).add(index);
        return this;
    }

    /**
     * Freezes the graph. Idempotent.
     */
    public ContributionGraph seal() {
        sealed = true;
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    public Optional<Node> node(NodeAddress address) {
        int index = nodeIndex.getInt(Objects.requireNonNull(address, "address"));
        return index == MISSING ? Optional.empty() : Optional.of(nodes.get(index));
    }

    public Optional<Edge> edge(EdgeAddress address) {
        int index = edgeIndex.getInt(Objects.requireNonNull(address, "address"));
        return index == MISSING ? Optional.empty() : Optional.of(edges.get(index));
    }

    public boolean containsNode(NodeAddress address) {
        return nodeIndex.containsKey(address);
    }

    public boolean containsEdge(EdgeAddress address) {
        return edgeIndex.containsKey(address);
    }

    /**
     * Returns insertion index of a node, or -1 when absent.
     */
    public int nodeIndexOf(NodeAddress address) {
        return nodeIndex.getInt(address);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * All nodes in insertion order.
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Nodes under the given prefix, in insertion order.
     */
    public List<Node> nodes(NodeAddress prefix) {
        Objects.requireNonNull(prefix, "prefix");
        ArrayList<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            if (node.address().hasPrefix(prefix)) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * All edges in insertion order.
     */
    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Edges under the given prefix, in insertion order.
     */
    public List<Edge> edges(EdgeAddress prefix) {
        Objects.requireNonNull(prefix, "prefix");
        ArrayList<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.address().hasPrefix(prefix)) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Edges whose dst is the given node, in insertion order. Unknown nodes yield an empty list.
     */
    public List<Edge> inEdges(NodeAddress address) {
        return adjacentEdges(inAdjacency, address);
    }

    /**
     * Edges whose src is the given node, in insertion order. Unknown nodes yield an empty list.
     */
    public List<Edge> outEdges(NodeAddress address) {
        return adjacentEdges(outAdjacency, address);
    }

    /**
     * Unions several graphs. Identical entries dedupe; conflicting entries fail.
     *
     * @throws CredRankException {@code MERGE_CONFLICT} when two graphs disagree on an address.
     */
    public static ContributionGraph merge(Collection<ContributionGraph> graphs) {
        Objects.requireNonNull(graphs, "graphs");
        ContributionGraph merged = new ContributionGraph();
        for (ContributionGraph graph : graphs) {
            for (Node node : Objects.requireNonNull(graph, "graph").nodes) {
                Optional<Node> existing = merged.node(node.address());
                if (existing.isPresent() && !existing.get().equals(node)) {
                    throw new CredRankException(
                            CredRankException.REASON_MERGE_CONFLICT,
                            "graphs disagree on node " + node.address()
                                    + ": " + existing.get() + " vs " + node
                    );
                }
                merged.addNode(node);
            }
        }
        for (ContributionGraph graph : graphs) {
            for (Edge edge : graph.edges) {
                Optional<Edge> existing = merged.edge(edge.address());
                if (existing.isPresent() && !existing.get().equals(edge)) {
                    throw new CredRankException(
                            CredRankException.REASON_MERGE_CONFLICT,
                            "graphs disagree on edge " + edge.address()
                                    + ": " + existing.get() + " vs " + edge
                    );
                }
                merged.addEdge(edge);
            }
        }
        return merged;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContributionGraph other)) {
            return false;
        }
        return nodes.size() == other.nodes.size()
                && edges.size() == other.edges.size()
                && new HashSet<>(nodes).equals(new HashSet<>(other.nodes))
                && new HashSet<>(edges).equals(new HashSet<>(other.edges));
    }

    @Override
    public int hashCode() {
        return new HashSet<>(nodes).hashCode() * 31 + new HashSet<>(edges).hashCode();
    }

    @Override
    public String toString() {
        return "ContributionGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }

    private List<Edge> adjacentEdges(List<IntArrayList> adjacency, NodeAddress address) {
        int index = nodeIndex.getInt(Objects.requireNonNull(address, "address"));
        if (index == MISSING) {
            return List.of();
        }
        IntArrayList edgeIds = adjacency.get(index);
        ArrayList<Edge> result = new ArrayList<>(edgeIds.size());
        for (int i = 0; i < edgeIds.size(); i++) {
            result.add(edges.get(edgeIds.getInt(i)));
        }
        return result;
    }

    private void ensureMutable() {
        if (sealed) {
            throw new IllegalStateException("graph is sealed");
        }
    }
}
