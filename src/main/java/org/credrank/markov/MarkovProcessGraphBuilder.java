package org.credrank.markov;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.credrank.core.CredRankException;
import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;
import org.credrank.core.time.IntervalSequence;
import org.credrank.graph.ContributionGraph;
import org.credrank.graph.Edge;
import org.credrank.graph.Node;
import org.credrank.weights.EdgeWeight;
import org.credrank.weights.WeightResolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rewrites a weighted contribution graph into a {@link MarkovProcessGraph}.
 *
 * <p>Participants are split into one epoch node per interval. Every contribution
 * edge that touches a participant is re-pointed at the epoch node of the interval
 * containing the edge timestamp. Seed, accumulator, payout, webbing, attribution
 * and radiation gadgets are then added so that every row is stochastic.</p>
 *
 * <p>Webbing only links two finite epochs; sentinel epochs send that mass to radiation.</p>
 */
@Slf4j
public final class MarkovProcessGraphBuilder {
    private static final double CLAMP_TOLERANCE = 1e-12d;
    private static final int MISSING = -1;

    private MarkovProcessGraphBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static MarkovProcessGraph build(
            ContributionGraph graph,
            WeightResolver resolver,
            IntervalSequence intervals,
            List<Participant> participants,
            Parameters parameters
    ) {
        return build(graph, resolver, intervals, participants, parameters, PersonalAttributions.empty());
    }

    /**
     * Builds the Markov process graph.
     *
     * @throws IllegalArgumentException when a participant is not a graph node or is listed twice.
     * @throws CredRankException {@code CONSTRUCTION_ERROR} when an organic node uses the gadget
     *                           namespace, a participant edge falls outside the intervals, or a row
     *                           does not sum to 1; {@code PARAMETER_ERROR} for attributions that name
     *                           unknown participants or exceed 1.
     */
    public static MarkovProcessGraph build(
            ContributionGraph graph,
            WeightResolver resolver,
            IntervalSequence intervals,
            List<Participant> participants,
            Parameters parameters,
            PersonalAttributions attributions
    ) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(resolver, "resolver");
        Objects.requireNonNull(intervals, "intervals");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(attributions, "attributions");
        List<Participant> sorted = sortParticipants(graph, participants);
        validateAttributions(sorted, attributions);

        int intervalCount = intervals.size();
        ArrayList<MarkovNode> nodes = new ArrayList<>();
        nodes.add(MarkovNode.seed());
        for (int k = 0; k < intervalCount; k++) {
            nodes.add(MarkovNode.accumulator(k, intervals.get(k).startMs()));
        }
        Object2IntOpenHashMap<NodeAddress> participantPosition = new Object2IntOpenHashMap<>();
        participantPosition.defaultReturnValue(MISSING);
        for (int p = 0; p < sorted.size(); p++) {
            Participant participant = sorted.get(p);
            participantPosition.put(participant.address(), p);
            for (int k = 0; k < intervalCount; k++) {
                nodes.add(MarkovNode.epoch(participant, k, intervals.get(k).startMs()));
            }
        }
        int firstEpoch = 1 + intervalCount;
        Object2IntOpenHashMap<NodeAddress> organicIndex = new Object2IntOpenHashMap<>();
        organicIndex.defaultReturnValue(MISSING);
        double totalMint = 0.0d;
        for (Node node : graph.nodes()) {
            if (participantPosition.containsKey(node.address())) {
                continue;
            }
            if (node.address().hasPrefix(Gadgets.NODE_PREFIX)) {
                throw constructionError("contribution node uses the reserved gadget namespace: " + node.address());
            }
            double mint = resolver.nodeWeight(node.address());
            organicIndex.put(node.address(), nodes.size());
            nodes.add(MarkovNode.organic(node.address(), node.description(), mint, node.timestampMs()));
            totalMint += mint;
        }

        // Contribution edges become candidate transitions grouped by MPG source row.
        ArrayList<List<Candidate>> candidatesByRow = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            candidatesByRow.add(null);
        }
        for (Edge edge : graph.edges()) {
            EdgeWeight weight = resolver.edgeWeight(edge.address());
            if (weight.isZero()) {
                continue;
            }
            int src = resolveEndpoint(edge, edge.src(), intervals, intervalCount, firstEpoch, participantPosition, organicIndex);
            int dst = resolveEndpoint(edge, edge.dst(), intervals, intervalCount, firstEpoch, participantPosition, organicIndex);
            if (weight.forwards() > 0.0d) {
                addCandidate(candidatesByRow, new Candidate(edge.address(), false, src, dst, weight.forwards()));
            }
            if (weight.backwards() > 0.0d) {
                addCandidate(candidatesByRow, new Candidate(edge.address(), true, dst, src, weight.backwards()));
            }
        }

        ArrayList<MarkovEdge> edges = new ArrayList<>();
        emitSeedRow(nodes, totalMint, edges);
        for (int k = 0; k < intervalCount; k++) {
            int accumulator = 1 + k;
            edges.add(radiation(nodes.get(accumulator), accumulator, 1.0d));
        }
        for (int p = 0; p < sorted.size(); p++) {
            for (int k = 0; k < intervalCount; k++) {
                emitEpochRow(sorted, p, k, intervals, parameters, attributions, candidatesByRow, nodes, edges);
            }
        }
        for (int row = firstEpoch + sorted.size() * intervalCount; row < nodes.size(); row++) {
            ArrayList<MarkovEdge> rowEdges = new ArrayList<>();
            emitOrganicShare(candidatesByRow.get(row), 1.0d - parameters.alpha(), rowEdges);
            closeRow(nodes.get(row), row, rowEdges, edges);
        }

        MarkovProcessGraph mpg = new MarkovProcessGraph(nodes, edges, intervals, sorted, parameters);
        log.debug(
                "built markov process graph: {} nodes, {} edges, {} intervals, {} participants, total mint {}",
                mpg.nodeCount(), mpg.edgeCount(), intervalCount, sorted.size(), totalMint
        );
        return mpg;
    }

    private static List<Participant> sortParticipants(ContributionGraph graph, List<Participant> participants) {
        Objects.requireNonNull(participants, "participants");
        Set<ParticipantId> ids = new HashSet<>();
        Set<NodeAddress> addresses = new HashSet<>();
        for (Participant participant : participants) {
            Objects.requireNonNull(participant, "participant");
            if (!ids.add(participant.id())) {
                throw new IllegalArgumentException("duplicate participant id " + participant.id());
            }
            if (!addresses.add(participant.address())) {
                throw new IllegalArgumentException("duplicate participant address " + participant.address());
            }
            if (!graph.containsNode(participant.address())) {
                throw new IllegalArgumentException("participant " + participant.address() + " is not a graph node");
            }
        }
        ArrayList<Participant> sorted = new ArrayList<>(participants);
        sorted.sort(Comparator.comparing(Participant::id));
        return sorted;
    }

    private static void validateAttributions(List<Participant> participants, PersonalAttributions attributions) {
        Set<ParticipantId> known = new HashSet<>();
        for (Participant participant : participants) {
            known.add(participant.id());
        }
        for (PersonalAttributions.PersonalAttribution attribution : attributions.attributions()) {
            if (!known.contains(attribution.fromParticipantId())) {
                throw new CredRankException(
                        CredRankException.REASON_PARAMETER_ERROR,
                        "attribution from unknown participant " + attribution.fromParticipantId()
                );
            }
            for (ParticipantId to : attributions.recipients(attribution.fromParticipantId())) {
                if (!known.contains(to)) {
                    throw new CredRankException(
                            CredRankException.REASON_PARAMETER_ERROR,
                            "attribution to unknown participant " + to
                    );
                }
            }
        }
    }

    private static int resolveEndpoint(
            Edge edge,
            NodeAddress endpoint,
            IntervalSequence intervals,
            int intervalCount,
            int firstEpoch,
            Object2IntOpenHashMap<NodeAddress> participantPosition,
            Object2IntOpenHashMap<NodeAddress> organicIndex
    ) {
        int p = participantPosition.getInt(endpoint);
        if (p == MISSING) {
            return organicIndex.getInt(endpoint);
        }
        int k = intervals.intervalIndexOf(edge.timestampMs());
        if (k < 0) {
            throw constructionError(
                    "edge " + edge.address() + " at " + edge.timestampMs() + " touches participant "
                            + endpoint + " outside every interval"
            );
        }
        return firstEpoch + p * intervalCount + k;
    }

    private static void addCandidate(List<List<Candidate>> candidatesByRow, Candidate candidate) {
        List<Candidate> row = candidatesByRow.get(candidate.src());
        if (row == null) {
            row = new ArrayList<>();
            candidatesByRow.set(candidate.src(), row);
        }
        row.add(candidate);
    }

    private static void emitSeedRow(List<MarkovNode> nodes, double totalMint, List<MarkovEdge> out) {
        if (totalMint <= 0.0d) {
            out.add(radiation(nodes.get(0), 0, 1.0d));
            return;
        }
        for (int i = 0; i < nodes.size(); i++) {
            MarkovNode node = nodes.get(i);
            if (node.kind() == MarkovNode.Kind.ORGANIC && node.mint() > 0.0d) {
                out.add(new MarkovEdge(
                        MarkovEdge.Kind.MINT,
                        Gadgets.mint(node.address()),
                        false,
                        0,
                        i,
                        node.mint() / totalMint
                ));
            }
        }
    }

    private static void emitEpochRow(
            List<Participant> participants,
            int p,
            int k,
            IntervalSequence intervals,
            Parameters parameters,
            PersonalAttributions attributions,
            List<List<Candidate>> candidatesByRow,
            List<MarkovNode> nodes,
            List<MarkovEdge> out
    ) {
        int intervalCount = intervals.size();
        int firstEpoch = 1 + intervalCount;
        int row = firstEpoch + p * intervalCount + k;
        ParticipantId owner = participants.get(p).id();
        long start = intervals.get(k).startMs();
        double beta = parameters.beta();
        ArrayList<MarkovEdge> rowEdges = new ArrayList<>();

        double attributed = attributions.totalProportion(start, owner);
        rowEdges.add(new MarkovEdge(
                MarkovEdge.Kind.PAYOUT,
                Gadgets.payout(owner, start),
                false,
                row,
                1 + k,
                clamp(beta * (1.0d - attributed))
        ));
        for (ParticipantId to : attributions.recipients(owner)) {
            double proportion = attributions.proportion(start, owner, to);
            if (proportion <= 0.0d) {
                continue;
            }
            int toPosition = indexOf(participants, to);
            rowEdges.add(new MarkovEdge(
                    MarkovEdge.Kind.ATTRIBUTION,
                    Gadgets.attribution(start, owner, to),
                    false,
                    row,
                    firstEpoch + toPosition * intervalCount + k,
                    beta * proportion
            ));
        }
        boolean finite = !intervals.get(k).isSentinel();
        if (finite && k + 1 < intervalCount && !intervals.get(k + 1).isSentinel()) {
            rowEdges.add(new MarkovEdge(
                    MarkovEdge.Kind.WEBBING_FORWARD,
                    Gadgets.webbing(owner, start, intervals.get(k + 1).startMs()),
                    false,
                    row,
                    row + 1,
                    parameters.gammaForward()
            ));
        }
        if (finite && k > 0 && !intervals.get(k - 1).isSentinel()) {
            rowEdges.add(new MarkovEdge(
                    MarkovEdge.Kind.WEBBING_BACKWARD,
                    Gadgets.webbing(owner, intervals.get(k - 1).startMs(), start),
                    true,
                    row,
                    row - 1,
                    parameters.gammaBackward()
            ));
        }
        emitOrganicShare(candidatesByRow.get(row), parameters.epochContributionBudget(), rowEdges);
        closeRow(nodes.get(row), row, rowEdges, out);
    }

    private static void emitOrganicShare(List<Candidate> candidates, double budget, List<MarkovEdge> rowEdges) {
        if (candidates == null || budget <= 0.0d) {
            return;
        }
        double totalWeight = 0.0d;
        for (Candidate candidate : candidates) {
            totalWeight += candidate.weight();
        }
        if (totalWeight <= 0.0d) {
            return;
        }
        for (Candidate candidate : candidates) {
            rowEdges.add(new MarkovEdge(
                    MarkovEdge.Kind.ORGANIC,
                    candidate.address(),
                    candidate.reversed(),
                    candidate.src(),
                    candidate.dst(),
                    budget * candidate.weight() / totalWeight
            ));
        }
    }

    /**
     * Appends the radiation edge carrying the rest of the row's mass and flushes the row.
     */
    private static void closeRow(MarkovNode node, int row, List<MarkovEdge> rowEdges, List<MarkovEdge> out) {
        double used = 0.0d;
        for (MarkovEdge edge : rowEdges) {
            used += edge.transitionProbability();
        }
        out.addAll(rowEdges);
        out.add(radiation(node, row, clamp(1.0d - used)));
    }

    private static MarkovEdge radiation(MarkovNode node, int row, double probability) {
        return new MarkovEdge(MarkovEdge.Kind.RADIATION, Gadgets.radiation(node.address()), false, row, 0, probability);
    }

    private static int indexOf(List<Participant> participants, ParticipantId id) {
        for (int i = 0; i < participants.size(); i++) {
            if (participants.get(i).id().equals(id)) {
                return i;
            }
        }
        throw new IllegalStateException("participant " + id + " missing after validation");
    }

    private static double clamp(double value) {
        if (value < 0.0d && value > -CLAMP_TOLERANCE) {
            return 0.0d;
        }
        return value;
    }

    private static CredRankException constructionError(String message) {
        return new CredRankException(CredRankException.REASON_CONSTRUCTION_ERROR, message);
    }

    private record Candidate(EdgeAddress address, boolean reversed, int src, int dst, double weight) {
    }
}
