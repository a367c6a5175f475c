package org.credrank.weights;

import lombok.Builder;
import lombok.Value;
import org.credrank.core.address.NodeAddress;

import java.util.Objects;

/**
 * Declared node type with a default mint weight.
 */
@Value
public class NodeType {
    String name;
    NodeAddress prefix;
    double defaultWeight;
    String description;

    @Builder
    public NodeType(String name, NodeAddress prefix, double defaultWeight, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.defaultWeight = EdgeWeight.requireWeight(defaultWeight, "defaultWeight");
        this.description = description == null ? "" : description;
    }
}
