package org.credrank.weights;

import org.credrank.core.CredRankException;
import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable explicit weight overrides keyed by exact address.
 *
 * <p>Node overrides replace the type default; edge overrides multiply it.</p>
 */
public final class WeightTable {
    private static final WeightTable EMPTY = new WeightTable(Map.of(), Map.of());

    private final Map<NodeAddress, Double> nodeWeights;
    private final Map<EdgeAddress, EdgeWeight> edgeWeights;

    private WeightTable(Map<NodeAddress, Double> nodeWeights, Map<EdgeAddress, EdgeWeight> edgeWeights) {
        this.nodeWeights = nodeWeights;
        this.edgeWeights = edgeWeights;
    }

    public static WeightTable empty() {
        return EMPTY;
    }

    /**
     * Creates a table from the given overrides, validating every value.
     */
    public static WeightTable of(Map<NodeAddress, Double> nodeWeights, Map<EdgeAddress, EdgeWeight> edgeWeights) {
        Objects.requireNonNull(nodeWeights, "nodeWeights");
        Objects.requireNonNull(edgeWeights, "edgeWeights");
        LinkedHashMap<NodeAddress, Double> nodes = new LinkedHashMap<>();
        for (Map.Entry<NodeAddress, Double> entry : nodeWeights.entrySet()) {
            NodeAddress address = Objects.requireNonNull(entry.getKey(), "node weight key");
            double weight = EdgeWeight.requireWeight(
                    Objects.requireNonNull(entry.getValue(), "node weight"),
                    "node weight for " + address
            );
            nodes.put(address, weight);
        }
        LinkedHashMap<EdgeAddress, EdgeWeight> edges = new LinkedHashMap<>();
        for (Map.Entry<EdgeAddress, EdgeWeight> entry : edgeWeights.entrySet()) {
            edges.put(
                    Objects.requireNonNull(entry.getKey(), "edge weight key"),
                    Objects.requireNonNull(entry.getValue(), "edge weight")
            );
        }
        return new WeightTable(Collections.unmodifiableMap(nodes), Collections.unmodifiableMap(edges));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Unambiguous union of several override sets.
     *
     * @throws CredRankException {@code WEIGHT_CONFLICT} when two tables set different values for one key.
     */
    public static WeightTable merge(Collection<WeightTable> tables) {
        Objects.requireNonNull(tables, "tables");
        LinkedHashMap<NodeAddress, Double> nodes = new LinkedHashMap<>();
        LinkedHashMap<EdgeAddress, EdgeWeight> edges = new LinkedHashMap<>();
        for (WeightTable table : tables) {
            Objects.requireNonNull(table, "table");
            for (Map.Entry<NodeAddress, Double> entry : table.nodeWeights.entrySet()) {
                Double previous = nodes.putIfAbsent(entry.getKey(), entry.getValue());
                if (previous != null && !previous.equals(entry.getValue())) {
                    throw new CredRankException(
                            CredRankException.REASON_WEIGHT_CONFLICT,
                            "conflicting node weights for " + entry.getKey() + ": " + previous + " vs " + entry.getValue()
                    );
                }
            }
            for (Map.Entry<EdgeAddress, EdgeWeight> entry : table.edgeWeights.entrySet()) {
                EdgeWeight previous = edges.putIfAbsent(entry.getKey(), entry.getValue());
                if (previous != null && !previous.equals(entry.getValue())) {
                    throw new CredRankException(
                            CredRankException.REASON_WEIGHT_CONFLICT,
                            "conflicting edge weights for " + entry.getKey() + ": " + previous + " vs " + entry.getValue()
                    );
                }
            }
        }
        return new WeightTable(Collections.unmodifiableMap(nodes), Collections.unmodifiableMap(edges));
    }

    public Map<NodeAddress, Double> nodeWeights() {
        return nodeWeights;
    }

    public Map<EdgeAddress, EdgeWeight> edgeWeights() {
        return edgeWeights;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WeightTable other)) {
            return false;
        }
        return nodeWeights.equals(other.nodeWeights) && edgeWeights.equals(other.edgeWeights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeWeights, edgeWeights);
    }

    /**
     * Mutable accumulator for overrides.
     */
    public static final class Builder {
        private final LinkedHashMap<NodeAddress, Double> nodeWeights = new LinkedHashMap<>();
        private final LinkedHashMap<EdgeAddress, EdgeWeight> edgeWeights = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder nodeWeight(NodeAddress address, double weight) {
            nodeWeights.put(Objects.requireNonNull(address, "address"), weight);
            return this;
        }

        public Builder edgeWeight(EdgeAddress address, double forwards, double backwards) {
            edgeWeights.put(Objects.requireNonNull(address, "address"), new EdgeWeight(forwards, backwards));
            return this;
        }

        public WeightTable build() {
            return WeightTable.of(nodeWeights, edgeWeights);
        }
    }
}
