package org.credrank.markov;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.credrank.core.CredRankException;
import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;
import org.credrank.core.time.IntervalSequence;
import org.credrank.solver.SparseMarkovChain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable Markov process graph.
 *
 * <p>Layout contract:</p>
 * <ul>
 * <li>node 0 is the seed, nodes {@code 1..I} are accumulators in interval order,
 * followed by {@code P * I} epoch nodes in (participant, interval) order and then
 * organic nodes;</li>
 * <li>edges are grouped by source node in node order, so the out-edges of a row
 * occupy the contiguous range {@code [rowStart[i], rowStart[i + 1])};</li>
 * <li>the first out-edge of every epoch node is its payout edge;</li>
 * <li>every row sums to 1 within {@link #ROW_SUM_TOLERANCE}.</li>
 * </ul>
 *
 * <p>Incoming edges are indexed CSR-style by destination, the way the in-neighbor
 * chain consumes them.</p>
 */
public final class MarkovProcessGraph {
    public static final double ROW_SUM_TOLERANCE = 1e-9d;
    private static final int MISSING = -1;

    private final List<MarkovNode> nodes;
    private final List<MarkovEdge> edges;
    private final IntervalSequence intervals;
    private final List<Participant> participants;
    private final Parameters parameters;

    private final int[] rowStart;
    private final int[] inStart;
    private final int[] inEdgeIds;
    private final Object2IntOpenHashMap<NodeAddress> nodeIndex;
    private final Object2IntOpenHashMap<EdgeAddress> edgeIndex;
    private final Object2IntOpenHashMap<ParticipantId> participantIndex;

    /**
     * Validates and indexes a complete graph.
     *
     * @param nodes nodes in layout order.
     * @param edges edges grouped by source in node order.
     * @param intervals epoch intervals.
     * @param participants participants sorted by id.
     * @param parameters parameters the transition probabilities were derived from.
     * @throws CredRankException {@code CONSTRUCTION_ERROR} when the layout contract is violated.
     */
    public MarkovProcessGraph(
            List<MarkovNode> nodes,
            List<MarkovEdge> edges,
            IntervalSequence intervals,
            List<Participant> participants,
            Parameters parameters
    ) {
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        this.edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        this.intervals = Objects.requireNonNull(intervals, "intervals");
        this.participants = List.copyOf(Objects.requireNonNull(participants, "participants"));
        this.parameters = Objects.requireNonNull(parameters, "parameters");

        this.participantIndex = new Object2IntOpenHashMap<>(this.participants.size());
        participantIndex.defaultReturnValue(MISSING);
        for (int p = 0; p < this.participants.size(); p++) {
            ParticipantId id = this.participants.get(p).id();
            if (p > 0 && this.participants.get(p - 1).id().compareTo(id) >= 0) {
                throw constructionError("participants must be sorted by id without duplicates at " + id);
            }
            participantIndex.put(id, p);
        }

        this.nodeIndex = new Object2IntOpenHashMap<>(this.nodes.size());
        nodeIndex.defaultReturnValue(MISSING);
        for (int i = 0; i < this.nodes.size(); i++) {
            MarkovNode node = this.nodes.get(i);
            if (nodeIndex.put(node.address(), i) != MISSING) {
                throw constructionError("duplicate node address at row " + i + ": " + node.address());
            }
            MarkovNode.Kind expected = expectedKind(i);
            if (node.kind() != expected) {
                throw constructionError(
                        "row " + i + " (" + node.address() + ") must be " + expected + " but is " + node.kind()
                );
            }
        }
        validateGadgetLayout();

        int n = this.nodes.size();
        this.rowStart = new int[n + 1];
        this.edgeIndex = new Object2IntOpenHashMap<>(this.edges.size());
        edgeIndex.defaultReturnValue(MISSING);
        int[] inDegree = new int[n];
        int previousSrc = 0;
        for (int e = 0; e < this.edges.size(); e++) {
            MarkovEdge edge = this.edges.get(e);
            if (edge.src() >= n || edge.dst() >= n) {
                throw constructionError("edge " + e + " (" + edge.address() + ") references a missing node");
            }
            if (edge.src() < previousSrc) {
                throw constructionError("edge " + e + " (" + edge.address() + ") breaks row grouping");
            }
            double p = edge.transitionProbability();
            if (p < 0.0d || p > 1.0d + ROW_SUM_TOLERANCE) {
                throw constructionError(
                        "edge " + e + " (" + edge.address() + ") has probability outside [0, 1]: " + p
                );
            }
            if (edgeIndex.put(edge.markovAddress(), e) != MISSING) {
                throw constructionError("duplicate edge address: " + edge.markovAddress());
            }
            previousSrc = edge.src();
            rowStart[edge.src() + 1]++;
            inDegree[edge.dst()]++;
        }
        for (int i = 0; i < n; i++) {
            rowStart[i + 1] += rowStart[i];
        }
        validateRowSums();
        validatePayoutEdges();

        this.inStart = new int[n + 1];
        for (int i = 0; i < n; i++) {
            inStart[i + 1] = inStart[i] + inDegree[i];
        }
        this.inEdgeIds = new int[this.edges.size()];
        int[] cursor = new int[n];
        for (int e = 0; e < this.edges.size(); e++) {
            int dst = this.edges.get(e).dst();
            inEdgeIds[inStart[dst] + cursor[dst]++] = e;
        }
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public MarkovNode node(int index) {
        return nodes.get(index);
    }

    /**
     * Returns the row of a node, or -1 when absent.
     */
    public int nodeIndex(NodeAddress address) {
        return nodeIndex.getInt(Objects.requireNonNull(address, "address"));
    }

    public List<MarkovNode> nodes() {
        return nodes;
    }

    /**
     * Nodes under the given prefix, in row order.
     */
    public List<MarkovNode> nodes(NodeAddress prefix) {
        Objects.requireNonNull(prefix, "prefix");
        ArrayList<MarkovNode> result = new ArrayList<>();
        for (MarkovNode node : nodes) {
            if (node.address().hasPrefix(prefix)) {
                result.add(node);
            }
        }
        return result;
    }

    public MarkovEdge edge(int index) {
        return edges.get(index);
    }

    /**
     * Returns the index of the edge with the given {@link MarkovEdge#markovAddress()}, or -1.
     */
    public int edgeIndex(EdgeAddress markovAddress) {
        return edgeIndex.getInt(Objects.requireNonNull(markovAddress, "markovAddress"));
    }

    /**
     * Returns the index of the edge with the given address and direction, or -1.
     */
    public int edgeIndex(EdgeAddress address, boolean reversed) {
        return edgeIndex(Gadgets.markovAddress(address, reversed));
    }

    public List<MarkovEdge> edges() {
        return edges;
    }

    /**
     * First edge index of a row; the row ends at {@code rowStart(row + 1)}.
     */
    public int rowStart(int row) {
        return rowStart[row];
    }

    public List<MarkovEdge> outEdges(int row) {
        return edges.subList(rowStart[row], rowStart[row + 1]);
    }

    /**
     * Edges into the given node, in edge order.
     */
    public List<MarkovEdge> inEdges(int node) {
        ArrayList<MarkovEdge> result = new ArrayList<>(inStart[node + 1] - inStart[node]);
        for (int k = inStart[node]; k < inStart[node + 1]; k++) {
            result.add(edges.get(inEdgeIds[k]));
        }
        return Collections.unmodifiableList(result);
    }

    public IntervalSequence intervals() {
        return intervals;
    }

    /**
     * Participants sorted by id.
     */
    public List<Participant> participants() {
        return participants;
    }

    public Parameters parameters() {
        return parameters;
    }

    /**
     * Position of a participant in {@link #participants()}, or -1.
     */
    public int participantIndex(ParticipantId id) {
        return participantIndex.getInt(Objects.requireNonNull(id, "id"));
    }

    public int seedIndex() {
        return 0;
    }

    public int accumulatorIndex(int intervalIndex) {
        Objects.checkIndex(intervalIndex, intervals.size());
        return 1 + intervalIndex;
    }

    /**
     * @throws IllegalArgumentException when the participant is unknown.
     */
    public int epochNodeIndex(ParticipantId id, int intervalIndex) {
        Objects.checkIndex(intervalIndex, intervals.size());
        int p = participantIndex(id);
        if (p == MISSING) {
            throw new IllegalArgumentException("unknown participant " + id);
        }
        return 1 + intervals.size() + p * intervals.size() + intervalIndex;
    }

    public int payoutEdgeIndex(ParticipantId id, int intervalIndex) {
        return rowStart[epochNodeIndex(id, intervalIndex)];
    }

    /**
     * Index of the first organic node.
     */
    public int firstOrganicIndex() {
        return 1 + intervals.size() * (1 + participants.size());
    }

    /**
     * In-neighbor sparse chain over the transition probabilities, in edge order per column.
     */
    public SparseMarkovChain toMarkovChain() {
        int[] sources = new int[inEdgeIds.length];
        double[] probabilities = new double[inEdgeIds.length];
        for (int k = 0; k < inEdgeIds.length; k++) {
            MarkovEdge edge = edges.get(inEdgeIds[k]);
            sources[k] = edge.src();
            probabilities[k] = edge.transitionProbability();
        }
        return new SparseMarkovChain(inStart.clone(), sources, probabilities);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MarkovProcessGraph other)) {
            return false;
        }
        return nodes.equals(other.nodes)
                && edges.equals(other.edges)
                && intervals.equals(other.intervals)
                && participants.equals(other.participants)
                && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges, intervals, participants, parameters);
    }

    @Override
    public String toString() {
        return "MarkovProcessGraph{nodes=" + nodes.size() + ", edges=" + edges.size()
                + ", intervals=" + intervals.size() + ", participants=" + participants.size() + "}";
    }

    private MarkovNode.Kind expectedKind(int row) {
        int intervalCount = intervals.size();
        if (row == 0) {
            return MarkovNode.Kind.SEED;
        }
        if (row <= intervalCount) {
            return MarkovNode.Kind.ACCUMULATOR;
        }
        if (row < 1 + intervalCount * (1 + participants.size())) {
            return MarkovNode.Kind.EPOCH;
        }
        return MarkovNode.Kind.ORGANIC;
    }

    private void validateGadgetLayout() {
        if (nodes.size() < firstOrganicIndex()) {
            throw constructionError("graph has " + nodes.size() + " nodes, fewer than its gadgets need");
        }
        for (int k = 0; k < intervals.size(); k++) {
            MarkovNode accumulator = nodes.get(accumulatorIndex(k));
            if (accumulator.intervalIndex() != k) {
                throw constructionError("accumulator " + accumulator.address() + " is not at interval " + k);
            }
            for (Participant participant : participants) {
                MarkovNode epoch = nodes.get(epochNodeIndex(participant.id(), k));
                if (!participant.id().equals(epoch.owner()) || epoch.intervalIndex() != k) {
                    throw constructionError(
                            "epoch node " + epoch.address() + " is not (" + participant.id() + ", " + k + ")"
                    );
                }
            }
        }
    }

    private void validateRowSums() {
        for (int row = 0; row < nodes.size(); row++) {
            double sum = 0.0d;
            for (int e = rowStart[row]; e < rowStart[row + 1]; e++) {
                sum += edges.get(e).transitionProbability();
            }
            if (Math.abs(sum - 1.0d) > ROW_SUM_TOLERANCE) {
                throw constructionError(
                        "row " + row + " (" + nodes.get(row).address() + ") sums to " + sum + ", expected 1"
                );
            }
        }
    }

    private void validatePayoutEdges() {
        for (Participant participant : participants) {
            for (int k = 0; k < intervals.size(); k++) {
                int row = epochNodeIndex(participant.id(), k);
                MarkovEdge first = edges.get(rowStart[row]);
                if (first.kind() != MarkovEdge.Kind.PAYOUT || first.dst() != accumulatorIndex(k)) {
                    throw constructionError(
                            "row " + row + " (" + nodes.get(row).address() + ") does not start with its payout edge"
                    );
                }
            }
        }
    }

    private static CredRankException constructionError(String message) {
        return new CredRankException(CredRankException.REASON_CONSTRUCTION_ERROR, message);
    }
}
