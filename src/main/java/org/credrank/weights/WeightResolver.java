package org.credrank.weights;

import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;

import java.util.Objects;

/**
 * Resolves effective node mint weights and edge weights.
 *
 * <ul>
 * <li>Node: explicit override, else the most specific node type default, else 0.</li>
 * <li>Edge: most specific edge type default (else zero) multiplied by the
 * explicit override (else neutral).</li>
 * </ul>
 */
public final class WeightResolver {
    private final DeclarationRegistry registry;
    private final WeightTable overrides;

    public WeightResolver(DeclarationRegistry registry, WeightTable overrides) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.overrides = Objects.requireNonNull(overrides, "overrides");
    }

    public DeclarationRegistry registry() {
        return registry;
    }

    public WeightTable overrides() {
        return overrides;
    }

    public double nodeWeight(NodeAddress address) {
        Double explicit = overrides.nodeWeights().get(Objects.requireNonNull(address, "address"));
        if (explicit != null) {
            return explicit;
        }
        NodeType type = registry.nodeType(address);
        return type == null ? 0.0d : type.getDefaultWeight();
    }

    public EdgeWeight edgeWeight(EdgeAddress address) {
        EdgeType type = registry.edgeType(Objects.requireNonNull(address, "address"));
        EdgeWeight base = type == null ? EdgeWeight.ZERO : type.getDefaultWeight();
        EdgeWeight explicit = overrides.edgeWeights().get(address);
        return explicit == null ? base : base.times(explicit);
    }
}
