package org.credrank.cred;

import org.credrank.core.CredRankException;
import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;
import org.credrank.core.time.IntervalSequence;
import org.credrank.markov.MarkovEdge;
import org.credrank.markov.MarkovNode;
import org.credrank.markov.MarkovProcessGraph;
import org.credrank.markov.Participant;
import org.credrank.markov.ParticipantId;
import org.credrank.solver.StationaryDistribution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Markov process graph annotated with Cred.
 *
 * <p>Scores are the stationary distribution rescaled so that all non-seed nodes
 * together hold the total mint. The seed keeps its rescaled score internally, since
 * mint edges flow out of it, but reports zero Cred. Dependency mint amounts are
 * stored per recipient and interval on top of the graph scores.</p>
 */
public final class CredGraph {
    private final MarkovProcessGraph mpg;
    private final double[] scores;
    private final Map<NodeAddress, double[]> dependencyCred;

    /**
     * @param mpg the graph the scores belong to.
     * @param scores rescaled score per node, including the seed.
     * @param dependencyCred per-interval dependency mint by recipient, in policy order.
     */
    public CredGraph(MarkovProcessGraph mpg, double[] scores, Map<NodeAddress, double[]> dependencyCred) {
        this.mpg = Objects.requireNonNull(mpg, "mpg");
        Objects.requireNonNull(scores, "scores");
        if (scores.length != mpg.nodeCount()) {
            throw new IllegalArgumentException(
                    "expected " + mpg.nodeCount() + " scores, got " + scores.length
            );
        }
        for (int i = 0; i < scores.length; i++) {
            if (!Double.isFinite(scores[i]) || scores[i] < 0.0d) {
                throw new IllegalArgumentException("score of node " + i + " must be finite and >= 0: " + scores[i]);
            }
        }
        this.scores = scores.clone();
        LinkedHashMap<NodeAddress, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<NodeAddress, double[]> entry : Objects.requireNonNull(dependencyCred, "dependencyCred").entrySet()) {
            if (mpg.nodeIndex(entry.getKey()) < 0) {
                throw new CredRankException(
                        CredRankException.REASON_UNKNOWN_RECIPIENT,
                        "dependency mint recipient is not a graph node: " + entry.getKey()
                );
            }
            if (entry.getValue().length != mpg.intervals().size()) {
                throw new IllegalArgumentException(
                        "dependency cred for " + entry.getKey() + " must have one value per interval"
                );
            }
            copy.put(entry.getKey(), entry.getValue().clone());
        }
        this.dependencyCred = Collections.unmodifiableMap(copy);
    }

    /**
     * Rescales a stationary distribution of {@code mpg} into Cred.
     */
    public static CredGraph fromStationaryDistribution(MarkovProcessGraph mpg, StationaryDistribution distribution) {
        Objects.requireNonNull(mpg, "mpg");
        Objects.requireNonNull(distribution, "distribution");
        if (distribution.size() != mpg.nodeCount()) {
            throw new IllegalArgumentException(
                    "distribution has " + distribution.size() + " entries for " + mpg.nodeCount() + " nodes"
            );
        }
        double totalMint = 0.0d;
        for (int i = mpg.firstOrganicIndex(); i < mpg.nodeCount(); i++) {
            totalMint += mpg.node(i).mint();
        }
        double nonSeed = 1.0d - distribution.probability(mpg.seedIndex());
        double scale = totalMint > 0.0d && nonSeed > 0.0d ? totalMint / nonSeed : 0.0d;
        double[] scores = distribution.pi();
        for (int i = 0; i < scores.length; i++) {
            scores[i] = Math.max(0.0d, scores[i]) * scale;
        }
        return new CredGraph(mpg, scores, Map.of());
    }

    public MarkovProcessGraph markovProcessGraph() {
        return mpg;
    }

    public IntervalSequence intervals() {
        return mpg.intervals();
    }

    /**
     * Rescaled scores per node, seed included.
     */
    public double[] scores() {
        return scores.clone();
    }

    /**
     * Cred of a node including dependency mint. The seed has no Cred.
     */
    public double nodeCred(int index) {
        if (index == mpg.seedIndex()) {
            return 0.0d;
        }
        return scores[index] + dependencyTotal(mpg.node(index).address());
    }

    /**
     * Cred of a graph node, or total Cred of a participant when given a participant address.
     *
     * @throws IllegalArgumentException when the address is neither.
     */
    public double nodeCred(NodeAddress address) {
        int index = mpg.nodeIndex(address);
        if (index >= 0) {
            return nodeCred(index);
        }
        for (Participant participant : mpg.participants()) {
            if (participant.address().equals(address)) {
                return participantCred(participant.id());
            }
        }
        throw new IllegalArgumentException("unknown node " + address);
    }

    /**
     * Cred flowing along one edge per step: {@code score[src] * p}.
     */
    public double edgeCredFlow(int edgeIndex) {
        MarkovEdge edge = mpg.edge(edgeIndex);
        return scores[edge.src()] * edge.transitionProbability();
    }

    /**
     * Cred flowing along the edge in the given direction, 0 when no such edge exists.
     */
    public double edgeCredFlow(EdgeAddress address, boolean reversed) {
        int index = mpg.edgeIndex(address, reversed);
        return index < 0 ? 0.0d : edgeCredFlow(index);
    }

    /**
     * Cred flowing along an edge address in both directions.
     */
    public double edgeCredFlow(EdgeAddress address) {
        return edgeCredFlow(address, false) + edgeCredFlow(address, true);
    }

    /**
     * Payout Cred of a participant per interval.
     *
     * @throws IllegalArgumentException when the participant is unknown.
     */
    public double[] participantCredPerInterval(ParticipantId id) {
        int intervalCount = mpg.intervals().size();
        double[] cred = new double[intervalCount];
        for (int k = 0; k < intervalCount; k++) {
            cred[k] = edgeCredFlow(mpg.payoutEdgeIndex(id, k));
        }
        return cred;
    }

    public double participantCred(ParticipantId id) {
        double total = 0.0d;
        for (double value : participantCredPerInterval(id)) {
            total += value;
        }
        return total;
    }

    /**
     * Cred summary of every participant, in id order.
     */
    public List<ParticipantCred> participants() {
        ArrayList<ParticipantCred> result = new ArrayList<>(mpg.participants().size());
        for (Participant participant : mpg.participants()) {
            double[] perInterval = participantCredPerInterval(participant.id());
            double total = 0.0d;
            for (double value : perInterval) {
                total += value;
            }
            result.add(new ParticipantCred(participant, perInterval, total));
        }
        return result;
    }

    /**
     * Sum of Cred over non-seed nodes plus all dependency mint.
     */
    public double totalCred() {
        double total = 0.0d;
        for (int i = 0; i < scores.length; i++) {
            if (i != mpg.seedIndex()) {
                total += scores[i];
            }
        }
        for (double[] amounts : dependencyCred.values()) {
            for (double amount : amounts) {
                total += amount;
            }
        }
        return total;
    }

    public List<CredNode> nodes() {
        ArrayList<CredNode> result = new ArrayList<>(mpg.nodeCount());
        for (int i = 0; i < mpg.nodeCount(); i++) {
            result.add(new CredNode(mpg.node(i), nodeCred(i)));
        }
        return result;
    }

    public List<CredEdge> edges() {
        ArrayList<CredEdge> result = new ArrayList<>(mpg.edgeCount());
        for (int e = 0; e < mpg.edgeCount(); e++) {
            result.add(new CredEdge(mpg.edge(e), edgeCredFlow(e)));
        }
        return result;
    }

    /**
     * Cred minted by the graph per interval: the mint of organic nodes created in that interval.
     * Timeless nodes do not count toward any interval.
     */
    public double[] mintedCredPerInterval() {
        IntervalSequence intervals = mpg.intervals();
        double[] minted = new double[intervals.size()];
        for (int i = 0; i < mpg.nodeCount(); i++) {
            MarkovNode node = mpg.node(i);
            if (node.kind() != MarkovNode.Kind.ORGANIC || node.timestampMs() == null) {
                continue;
            }
            int k = intervals.intervalIndexOf(node.timestampMs());
            if (k >= 0) {
                minted[k] += node.mint();
            }
        }
        return minted;
    }

    /**
     * Returns a copy whose dependency mint is computed from the given policies,
     * replacing any dependency mint already present.
     *
     * @throws CredRankException {@code UNKNOWN_RECIPIENT} when a recipient is not a graph node,
     *                           {@code POLICY_ERROR} when a recipient has more than one policy.
     */
    public CredGraph withDependencyMint(List<DependencyMintPolicy> policies) {
        Objects.requireNonNull(policies, "policies");
        double[] minted = mintedCredPerInterval();
        long[] starts = mpg.intervals().starts();
        LinkedHashMap<NodeAddress, double[]> amounts = new LinkedHashMap<>();
        for (DependencyMintPolicy policy : policies) {
            if (mpg.nodeIndex(policy.recipient()) < 0) {
                throw new CredRankException(
                        CredRankException.REASON_UNKNOWN_RECIPIENT,
                        "dependency mint recipient is not a graph node: " + policy.recipient()
                );
            }
            if (amounts.containsKey(policy.recipient())) {
                throw new CredRankException(
                        CredRankException.REASON_POLICY_ERROR,
                        "more than one dependency mint policy for " + policy.recipient()
                );
            }
            double[] weights = policy.weightsForIntervals(starts);
            double[] perInterval = new double[minted.length];
            for (int k = 0; k < minted.length; k++) {
                perInterval[k] = weights[k] * minted[k];
            }
            amounts.put(policy.recipient(), perInterval);
        }
        return new CredGraph(mpg, scores, amounts);
    }

    /**
     * Dependency mint of a recipient per interval; zeros when it has none.
     */
    public double[] dependencyCredPerInterval(NodeAddress recipient) {
        double[] amounts = dependencyCred.get(Objects.requireNonNull(recipient, "recipient"));
        return amounts == null ? new double[mpg.intervals().size()] : amounts.clone();
    }

    /**
     * Recipients with dependency mint, in policy order.
     */
    public List<NodeAddress> dependencyRecipients() {
        return List.copyOf(dependencyCred.keySet());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CredGraph other)) {
            return false;
        }
        if (!mpg.equals(other.mpg) || !Arrays.equals(scores, other.scores)) {
            return false;
        }
        if (!dependencyRecipients().equals(other.dependencyRecipients())) {
            return false;
        }
        for (Map.Entry<NodeAddress, double[]> entry : dependencyCred.entrySet()) {
            if (!Arrays.equals(entry.getValue(), other.dependencyCred.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return 31 * mpg.hashCode() + Arrays.hashCode(scores);
    }

    @Override
    public String toString() {
        return "CredGraph{" + mpg + ", totalCred=" + totalCred() + "}";
    }

    private double dependencyTotal(NodeAddress address) {
        double[] amounts = dependencyCred.get(address);
        if (amounts == null) {
            return 0.0d;
        }
        double total = 0.0d;
        for (double amount : amounts) {
            total += amount;
        }
        return total;
    }
}
