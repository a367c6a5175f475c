package org.credrank.serialization.flexbuffers;

import com.google.flatbuffers.ArrayReadWriteBuf;
import com.google.flatbuffers.FlexBuffers;
import com.google.flatbuffers.FlexBuffersBuilder;
import lombok.experimental.UtilityClass;
import org.credrank.core.CredRankException;
import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;
import org.credrank.core.time.Interval;
import org.credrank.core.time.IntervalSequence;
import org.credrank.cred.CredGraph;
import org.credrank.markov.MarkovEdge;
import org.credrank.markov.MarkovNode;
import org.credrank.markov.MarkovProcessGraph;
import org.credrank.markov.Parameters;
import org.credrank.markov.Participant;
import org.credrank.markov.ParticipantId;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * FlexBuffers codec for {@link CredGraph} snapshots.
 *
 * <p>The root map carries the {@code type}/{@code version} header followed by the
 * intervals, parameters, participants, nodes and edges in graph order, the
 * per-node scores as 64-bit floats and the dependency mint amounts. Addresses are
 * stored as blobs of their raw string form.</p>
 */
@UtilityClass
public final class CredGraphSnapshots {
    private static final int INITIAL_BUFFER_SIZE = 4096;

    private static final String KEY_INTERVALS = "intervals";
    private static final String KEY_PARAMETERS = "parameters";
    private static final String KEY_PARTICIPANTS = "participants";
    private static final String KEY_NODES = "nodes";
    private static final String KEY_EDGES = "edges";
    private static final String KEY_SCORES = "scores";
    private static final String KEY_DEPENDENCY_MINT = "dependencyMint";

    private static final String KEY_START = "start";
    private static final String KEY_END = "end";
    private static final String KEY_ALPHA = "alpha";
    private static final String KEY_BETA = "beta";
    private static final String KEY_GAMMA_FORWARD = "gammaForward";
    private static final String KEY_GAMMA_BACKWARD = "gammaBackward";
    private static final String KEY_ADDRESS = "address";
    private static final String KEY_DESCRIPTION = "description";
    private static final String KEY_ID = "id";
    private static final String KEY_KIND = "kind";
    private static final String KEY_MINT = "mint";
    private static final String KEY_INTERVAL = "interval";
    private static final String KEY_OWNER = "owner";
    private static final String KEY_TIMESTAMP = "timestamp";
    private static final String KEY_REVERSED = "reversed";
    private static final String KEY_SRC = "src";
    private static final String KEY_DST = "dst";
    private static final String KEY_PROBABILITY = "probability";
    private static final String KEY_RECIPIENT = "recipient";
    private static final String KEY_AMOUNTS = "amounts";

    /**
     * Encodes a Cred graph.
     */
    public static byte[] toSnapshot(CredGraph credGraph) {
        Objects.requireNonNull(credGraph, "credGraph");
        MarkovProcessGraph mpg = credGraph.markovProcessGraph();
        FlexBuffersBuilder builder = new FlexBuffersBuilder(INITIAL_BUFFER_SIZE);
        int root = builder.startMap();
        builder.putString(SnapshotContractValidator.KEY_TYPE, SnapshotContractValidator.SNAPSHOT_TYPE);
        builder.putString(SnapshotContractValidator.KEY_VERSION, SnapshotContractValidator.SNAPSHOT_VERSION);

        int intervals = builder.startVector();
        for (Interval interval : mpg.intervals()) {
            int entry = builder.startMap();
            builder.putInt(KEY_START, interval.startMs());
            builder.putInt(KEY_END, interval.endMs());
            builder.endMap(null, entry);
        }
        builder.endVector(KEY_INTERVALS, intervals, false, false);

        Parameters parameters = mpg.parameters();
        int parameterMap = builder.startMap();
        builder.putFloat(KEY_ALPHA, parameters.alpha());
        builder.putFloat(KEY_BETA, parameters.beta());
        builder.putFloat(KEY_GAMMA_FORWARD, parameters.gammaForward());
        builder.putFloat(KEY_GAMMA_BACKWARD, parameters.gammaBackward());
        builder.endMap(KEY_PARAMETERS, parameterMap);

        int participants = builder.startVector();
        for (Participant participant : mpg.participants()) {
            int entry = builder.startMap();
            builder.putBlob(KEY_ADDRESS, rawBytes(participant.address().toRawString()));
            builder.putString(KEY_DESCRIPTION, participant.description());
            builder.putString(KEY_ID, participant.id().toString());
            builder.endMap(null, entry);
        }
        builder.endVector(KEY_PARTICIPANTS, participants, false, false);

        int nodes = builder.startVector();
        for (MarkovNode node : mpg.nodes()) {
            int entry = builder.startMap();
            builder.putString(KEY_KIND, node.kind().name());
            builder.putBlob(KEY_ADDRESS, rawBytes(node.address().toRawString()));
            builder.putString(KEY_DESCRIPTION, node.description());
            builder.putFloat(KEY_MINT, node.mint());
            builder.putInt(KEY_INTERVAL, node.intervalIndex());
            if (node.owner() != null) {
                builder.putString(KEY_OWNER, node.owner().toString());
            }
            if (node.timestampMs() != null) {
                builder.putInt(KEY_TIMESTAMP, node.timestampMs().longValue());
            }
            builder.endMap(null, entry);
        }
        builder.endVector(KEY_NODES, nodes, false, false);

        int edges = builder.startVector();
        for (MarkovEdge edge : mpg.edges()) {
            int entry = builder.startMap();
            builder.putString(KEY_KIND, edge.kind().name());
            builder.putBlob(KEY_ADDRESS, rawBytes(edge.address().toRawString()));
            builder.putBoolean(KEY_REVERSED, edge.reversed());
            builder.putInt(KEY_SRC, edge.src());
            builder.putInt(KEY_DST, edge.dst());
            builder.putFloat(KEY_PROBABILITY, edge.transitionProbability());
            builder.endMap(null, entry);
        }
        builder.endVector(KEY_EDGES, edges, false, false);

        putFloats(builder, KEY_SCORES, credGraph.scores());

        int dependencyMint = builder.startVector();
        for (NodeAddress recipient : credGraph.dependencyRecipients()) {
            int entry = builder.startMap();
            builder.putBlob(KEY_RECIPIENT, rawBytes(recipient.toRawString()));
            putFloats(builder, KEY_AMOUNTS, credGraph.dependencyCredPerInterval(recipient));
            builder.endMap(null, entry);
        }
        builder.endVector(KEY_DEPENDENCY_MINT, dependencyMint, false, false);

        builder.endMap(null, root);
        ByteBuffer buffer = builder.finish();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    /**
     * Decodes a snapshot produced by {@link #toSnapshot(CredGraph)}.
     *
     * @throws CredRankException {@code SNAPSHOT_VERSION} for a foreign type, an incompatible
     *                           version or a malformed payload.
     */
    public static CredGraph fromSnapshot(byte[] snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        FlexBuffers.Map root;
        try {
            FlexBuffers.Reference reference = FlexBuffers.getRoot(new ArrayReadWriteBuf(snapshot, snapshot.length));
            if (!reference.isMap()) {
                throw SnapshotContractValidator.versionError("snapshot root is not a map");
            }
            root = reference.asMap();
        } catch (CredRankException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new CredRankException(CredRankException.REASON_SNAPSHOT_VERSION, "malformed snapshot", ex);
        }
        SnapshotContractValidator.validateHeader(root);
        try {
            return decode(root);
        } catch (CredRankException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new CredRankException(
                    CredRankException.REASON_SNAPSHOT_VERSION,
                    "malformed snapshot: " + ex.getMessage(),
                    ex
            );
        }
    }

    private static CredGraph decode(FlexBuffers.Map root) {
        FlexBuffers.Vector intervalVector = require(root, KEY_INTERVALS).asVector();
        ArrayList<Interval> intervals = new ArrayList<>(intervalVector.size());
        for (int i = 0; i < intervalVector.size(); i++) {
            FlexBuffers.Map entry = intervalVector.get(i).asMap();
            intervals.add(new Interval(require(entry, KEY_START).asLong(), require(entry, KEY_END).asLong()));
        }

        FlexBuffers.Map parameterMap = require(root, KEY_PARAMETERS).asMap();
        Parameters parameters = new Parameters(
                require(parameterMap, KEY_ALPHA).asFloat(),
                require(parameterMap, KEY_BETA).asFloat(),
                require(parameterMap, KEY_GAMMA_FORWARD).asFloat(),
                require(parameterMap, KEY_GAMMA_BACKWARD).asFloat()
        );

        FlexBuffers.Vector participantVector = require(root, KEY_PARTICIPANTS).asVector();
        ArrayList<Participant> participants = new ArrayList<>(participantVector.size());
        for (int i = 0; i < participantVector.size(); i++) {
            FlexBuffers.Map entry = participantVector.get(i).asMap();
            participants.add(new Participant(
                    NodeAddress.fromRawString(rawString(require(entry, KEY_ADDRESS))),
                    require(entry, KEY_DESCRIPTION).asString(),
                    ParticipantId.parse(require(entry, KEY_ID).asString())
            ));
        }

        FlexBuffers.Vector nodeVector = require(root, KEY_NODES).asVector();
        ArrayList<MarkovNode> nodes = new ArrayList<>(nodeVector.size());
        for (int i = 0; i < nodeVector.size(); i++) {
            FlexBuffers.Map entry = nodeVector.get(i).asMap();
            FlexBuffers.Reference owner = entry.get(KEY_OWNER);
            FlexBuffers.Reference timestamp = entry.get(KEY_TIMESTAMP);
            nodes.add(new MarkovNode(
                    MarkovNode.Kind.valueOf(require(entry, KEY_KIND).asString()),
                    NodeAddress.fromRawString(rawString(require(entry, KEY_ADDRESS))),
                    require(entry, KEY_DESCRIPTION).asString(),
                    require(entry, KEY_MINT).asFloat(),
                    (int) require(entry, KEY_INTERVAL).asLong(),
                    owner.isNull() ? null : ParticipantId.parse(owner.asString()),
                    timestamp.isNull() ? null : timestamp.asLong()
            ));
        }

        FlexBuffers.Vector edgeVector = require(root, KEY_EDGES).asVector();
        ArrayList<MarkovEdge> edges = new ArrayList<>(edgeVector.size());
        for (int i = 0; i < edgeVector.size(); i++) {
            FlexBuffers.Map entry = edgeVector.get(i).asMap();
            edges.add(new MarkovEdge(
                    MarkovEdge.Kind.valueOf(require(entry, KEY_KIND).asString()),
                    EdgeAddress.fromRawString(rawString(require(entry, KEY_ADDRESS))),
                    require(entry, KEY_REVERSED).asBoolean(),
                    (int) require(entry, KEY_SRC).asLong(),
                    (int) require(entry, KEY_DST).asLong(),
                    require(entry, KEY_PROBABILITY).asFloat()
            ));
        }

        MarkovProcessGraph mpg = new MarkovProcessGraph(
                nodes,
                edges,
                IntervalSequence.of(intervals),
                participants,
                parameters
        );
        double[] scores = readFloats(require(root, KEY_SCORES).asVector());

        FlexBuffers.Vector dependencyVector = require(root, KEY_DEPENDENCY_MINT).asVector();
        LinkedHashMap<NodeAddress, double[]> dependencyCred = new LinkedHashMap<>();
        for (int i = 0; i < dependencyVector.size(); i++) {
            FlexBuffers.Map entry = dependencyVector.get(i).asMap();
            dependencyCred.put(
                    NodeAddress.fromRawString(rawString(require(entry, KEY_RECIPIENT))),
                    readFloats(require(entry, KEY_AMOUNTS).asVector())
            );
        }
        return new CredGraph(mpg, scores, dependencyCred);
    }

    private static void putFloats(FlexBuffersBuilder builder, String key, double[] values) {
        int start = builder.startVector();
        for (double value : values) {
            builder.putFloat(value);
        }
        builder.endVector(key, start, false, false);
    }

    private static double[] readFloats(FlexBuffers.Vector vector) {
        double[] values = new double[vector.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = vector.get(i).asFloat();
        }
        return values;
    }

    private static FlexBuffers.Reference require(FlexBuffers.Map map, String key) {
        FlexBuffers.Reference reference = map.get(key);
        if (reference.isNull()) {
            throw SnapshotContractValidator.versionError("malformed snapshot: missing key '" + key + "'");
        }
        return reference;
    }

    private static byte[] rawBytes(String raw) {
        return raw.getBytes(StandardCharsets.UTF_8);
    }

    private static String rawString(FlexBuffers.Reference reference) {
        return new String(reference.asBlob().getBytes(), StandardCharsets.UTF_8);
    }
}
