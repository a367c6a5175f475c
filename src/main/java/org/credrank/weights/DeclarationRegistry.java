package org.credrank.weights;

import org.credrank.core.CredRankException;
import org.credrank.core.address.AddressTrie;
import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;
import org.credrank.graph.ContributionGraph;
import org.credrank.graph.Edge;
import org.credrank.graph.Node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable index over plugin declarations.
 *
 * <p>Owns two kinds of prefix tries: declaration namespaces (used for coverage
 * validation) and typed prefixes (used for default-weight dispatch).</p>
 */
public final class DeclarationRegistry {
    private final List<PluginDeclaration> declarations;
    private final AddressTrie<NodeAddress, List<PluginDeclaration>> nodeClaims = new AddressTrie<>();
    private final AddressTrie<EdgeAddress, List<PluginDeclaration>> edgeClaims = new AddressTrie<>();
    private final AddressTrie<NodeAddress, NodeType> nodeTypes = new AddressTrie<>();
    private final AddressTrie<EdgeAddress, EdgeType> edgeTypes = new AddressTrie<>();

    /**
     * Indexes the given declarations.
     *
     * @throws IllegalArgumentException when two types share one prefix.
     */
    public DeclarationRegistry(Collection<PluginDeclaration> declarations) {
        Objects.requireNonNull(declarations, "declarations");
        this.declarations = List.copyOf(declarations);

        LinkedHashMap<NodeAddress, List<PluginDeclaration>> byNodePrefix = new LinkedHashMap<>();
        LinkedHashMap<EdgeAddress, List<PluginDeclaration>> byEdgePrefix = new LinkedHashMap<>();
        for (PluginDeclaration declaration : this.declarations) {
            byNodePrefix.computeIfAbsent(declaration.getNodePrefix(), ignored -> new ArrayList<>()).add(declaration);
            byEdgePrefix.computeIfAbsent(declaration.getEdgePrefix(), ignored -> new ArrayList<>()).add(declaration);
            for (NodeType type : declaration.getNodeTypes()) {
                nodeTypes.add(type.getPrefix(), type);
            }
            for (EdgeType type : declaration.getEdgeTypes()) {
                edgeTypes.add(type.getPrefix(), type);
            }
        }
        for (Map.Entry<NodeAddress, List<PluginDeclaration>> entry : byNodePrefix.entrySet()) {
            nodeClaims.add(entry.getKey(), List.copyOf(entry.getValue()));
        }
        for (Map.Entry<EdgeAddress, List<PluginDeclaration>> entry : byEdgePrefix.entrySet()) {
            edgeClaims.add(entry.getKey(), List.copyOf(entry.getValue()));
        }
    }

    public List<PluginDeclaration> declarations() {
        return declarations;
    }

    /**
     * Most specific node type whose prefix matches, or {@code null}.
     */
    public NodeType nodeType(NodeAddress address) {
        return nodeTypes.getLast(address);
    }

    /**
     * Most specific edge type whose prefix matches, or {@code null}.
     */
    public EdgeType edgeType(EdgeAddress address) {
        return edgeTypes.getLast(address);
    }

    /**
     * Declarations whose node namespace contains the address.
     */
    public List<PluginDeclaration> claimsOf(NodeAddress address) {
        return flatten(nodeClaims.get(address));
    }

    /**
     * Declarations whose edge namespace contains the address.
     */
    public List<PluginDeclaration> claimsOf(EdgeAddress address) {
        return flatten(edgeClaims.get(address));
    }

    /**
     * Checks that every node and edge of the graph is claimed by exactly one declaration.
     *
     * @throws CredRankException {@code UNCLAIMED_ADDRESS} naming the first offending address.
     */
    public void validateCoverage(ContributionGraph graph) {
        Objects.requireNonNull(graph, "graph");
        for (Node node : graph.nodes()) {
            requireSingleClaim(claimsOf(node.address()), node.address().toString());
        }
        for (Edge edge : graph.edges()) {
            requireSingleClaim(claimsOf(edge.address()), edge.address().toString());
        }
    }

    private static void requireSingleClaim(List<PluginDeclaration> claims, String address) {
        if (claims.size() == 1) {
            return;
        }
        if (claims.isEmpty()) {
            throw new CredRankException(
                    CredRankException.REASON_UNCLAIMED_ADDRESS,
                    "no declaration claims " + address
            );
        }
        ArrayList<String> names = new ArrayList<>(claims.size());
        for (PluginDeclaration claim : claims) {
            names.add(claim.getName());
        }
        throw new CredRankException(
                CredRankException.REASON_UNCLAIMED_ADDRESS,
                address + " is claimed by several declarations " + names
        );
    }

    private static List<PluginDeclaration> flatten(List<List<PluginDeclaration>> nested) {
        if (nested.isEmpty()) {
            return List.of();
        }
        if (nested.size() == 1) {
            return nested.get(0);
        }
        ArrayList<PluginDeclaration> flat = new ArrayList<>();
        for (List<PluginDeclaration> group : nested) {
            flat.addAll(group);
        }
        return flat;
    }
}
