package org.credrank.weights;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;

import java.util.List;
import java.util.Objects;

/**
 * What one ingestion plugin claims: its address namespaces and its typed defaults.
 *
 * <p>Every node and edge type prefix must live under the declaration's own
 * node or edge prefix.</p>
 */
@Value
public class PluginDeclaration {
    String name;
    NodeAddress nodePrefix;
    EdgeAddress edgePrefix;
    List<NodeType> nodeTypes;
    List<EdgeType> edgeTypes;

    @Builder
    public PluginDeclaration(
            String name,
            NodeAddress nodePrefix,
            EdgeAddress edgePrefix,
            @Singular List<NodeType> nodeTypes,
            @Singular List<EdgeType> edgeTypes
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.nodePrefix = Objects.requireNonNull(nodePrefix, "nodePrefix");
        this.edgePrefix = Objects.requireNonNull(edgePrefix, "edgePrefix");
        this.nodeTypes = List.copyOf(Objects.requireNonNull(nodeTypes, "nodeTypes"));
        this.edgeTypes = List.copyOf(Objects.requireNonNull(edgeTypes, "edgeTypes"));
        for (NodeType type : this.nodeTypes) {
            if (!type.getPrefix().hasPrefix(nodePrefix)) {
                throw new IllegalArgumentException(
                        name + ": node type " + type.getName() + " is outside node prefix " + nodePrefix
                );
            }
        }
        for (EdgeType type : this.edgeTypes) {
            if (!type.getPrefix().hasPrefix(edgePrefix)) {
                throw new IllegalArgumentException(
                        name + ": edge type " + type.getForwardName() + " is outside edge prefix " + edgePrefix
                );
            }
        }
    }
}
