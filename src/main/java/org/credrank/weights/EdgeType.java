package org.credrank.weights;

import lombok.Builder;
import lombok.Value;
import org.credrank.core.address.EdgeAddress;

import java.util.Objects;

/**
 * Declared edge type with default forward and backward weights.
 */
@Value
public class EdgeType {
    String forwardName;
    String backwardName;
    EdgeAddress prefix;
    EdgeWeight defaultWeight;
    String description;

    @Builder
    public EdgeType(
            String forwardName,
            String backwardName,
            EdgeAddress prefix,
            EdgeWeight defaultWeight,
            String description
    ) {
        this.forwardName = Objects.requireNonNull(forwardName, "forwardName");
        this.backwardName = Objects.requireNonNull(backwardName, "backwardName");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.defaultWeight = Objects.requireNonNull(defaultWeight, "defaultWeight");
        this.description = description == null ? "" : description;
    }
}
