package org.credrank.graph;

import org.credrank.core.CredRankException;
import org.credrank.core.address.EdgeAddress;
import org.credrank.core.address.NodeAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.credrank.testutil.CredRankFixtures.edge;
import static org.credrank.testutil.CredRankFixtures.edgeAddress;
import static org.credrank.testutil.CredRankFixtures.node;
import static org.credrank.testutil.CredRankFixtures.nodeAddress;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ContributionGraph Tests")
class ContributionGraphTest {

    private static ContributionGraph triangle() {
        return new ContributionGraph()
                .addNode(node("a", 1L))
                .addNode(node("b", 2L))
                .addNode(Node.timeless(nodeAddress("c"), "c"))
                .addEdge(edge("ab", "a", "b", 3L))
                .addEdge(edge("bc", "b", "c", 4L))
                .addEdge(edge("ca", "c", "a", 5L))
                .addEdge(edge("aa", "a", "a", 6L));
    }

    @Test
    @DisplayName("Lookups and adjacency follow insertion order")
    void testLookupsAndAdjacency() {
        ContributionGraph graph = triangle();
        assertEquals(3, graph.nodeCount());
        assertEquals(4, graph.edgeCount());
        assertTrue(graph.containsNode(nodeAddress("a")));
        assertTrue(graph.node(nodeAddress("c")).orElseThrow().isTimeless());
        assertEquals(nodeAddress("b"), graph.edge(edgeAddress("ab")).orElseThrow().dst());
        assertFalse(graph.node(nodeAddress("zzz")).isPresent());
        assertEquals(-1, graph.nodeIndexOf(nodeAddress("zzz")));

        assertEquals(List.of(edgeAddress("ab"), edgeAddress("aa")), addresses(graph.outEdges(nodeAddress("a"))));
        assertEquals(List.of(edgeAddress("ca"), edgeAddress("aa")), addresses(graph.inEdges(nodeAddress("a"))));
        assertEquals(List.of(), graph.outEdges(nodeAddress("missing")));
    }

    @Test
    @DisplayName("Prefix filters")
    void testPrefixFilters() {
        ContributionGraph graph = triangle();
        assertEquals(3, graph.nodes(NodeAddress.of("test")).size());
        assertEquals(1, graph.nodes(nodeAddress("b")).size());
        assertEquals(0, graph.edges(EdgeAddress.of("other")).size());
        assertEquals(4, graph.edges(EdgeAddress.EMPTY).size());
    }

    @Test
    @DisplayName("Identical re-adds are no-ops; conflicting re-adds fail")
    void testDuplicateHandling() {
        ContributionGraph graph = triangle();
        graph.addNode(node("a", 1L));
        graph.addEdge(edge("ab", "a", "b", 3L));
        assertEquals(3, graph.nodeCount());
        assertEquals(4, graph.edgeCount());

        CredRankException nodeEx = assertThrows(CredRankException.class, () -> graph.addNode(node("a", 99L)));
        assertEquals(CredRankException.REASON_DUPLICATE_ADDRESS, nodeEx.getReasonCode());
        CredRankException edgeEx = assertThrows(CredRankException.class, () -> graph.addEdge(edge("ab", "b", "a", 3L)));
        assertEquals(CredRankException.REASON_DUPLICATE_ADDRESS, edgeEx.getReasonCode());
    }

    @Test
    @DisplayName("Edges to missing nodes are dangling")
    void testDanglingEdge() {
        ContributionGraph graph = new ContributionGraph().addNode(node("a", 1L));
        CredRankException ex = assertThrows(CredRankException.class, () -> graph.addEdge(edge("ax", "a", "x", 1L)));
        assertEquals(CredRankException.REASON_DANGLING_EDGE, ex.getReasonCode());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    @DisplayName("Sealed graphs reject mutation")
    void testSeal() {
        ContributionGraph graph = triangle().seal();
        assertTrue(graph.isSealed());
        assertThrows(IllegalStateException.class, () -> graph.addNode(node("d", 1L)));
    }

    @Test
    @DisplayName("Equality ignores insertion order")
    void testStructuralEquality() {
        ContributionGraph reordered = new ContributionGraph()
                .addNode(Node.timeless(nodeAddress("c"), "c"))
                .addNode(node("b", 2L))
                .addNode(node("a", 1L))
                .addEdge(edge("aa", "a", "a", 6L))
                .addEdge(edge("ca", "c", "a", 5L))
                .addEdge(edge("bc", "b", "c", 4L))
                .addEdge(edge("ab", "a", "b", 3L));
        assertEquals(triangle(), reordered);
        assertEquals(triangle().hashCode(), reordered.hashCode());
        assertEquals(triangle(), reordered.seal());
        assertNotEquals(triangle(), triangle().addEdge(edge("ba", "b", "a", 7L)));
    }

    @Test
    @DisplayName("Merge unions graphs and dedupes identical entries")
    void testMerge() {
        ContributionGraph left = new ContributionGraph()
                .addNode(node("a", 1L))
                .addNode(node("b", 2L))
                .addEdge(edge("ab", "a", "b", 3L));
        ContributionGraph right = new ContributionGraph()
                .addNode(node("b", 2L))
                .addNode(node("c", 3L))
                .addEdge(edge("bc", "b", "c", 4L));
        ContributionGraph merged = ContributionGraph.merge(List.of(left, right));
        assertEquals(3, merged.nodeCount());
        assertEquals(2, merged.edgeCount());
        assertEquals(left, ContributionGraph.merge(List.of(left, left)));
    }

    @Test
    @DisplayName("Merge resolves edges whose endpoints come from another graph")
    void testMergeCrossGraphEdges() {
        ContributionGraph nodesOnly = new ContributionGraph().addNode(node("a", 1L)).addNode(node("b", 2L));
        ContributionGraph edgeOnly = new ContributionGraph()
                .addNode(node("a", 1L))
                .addNode(node("b", 2L))
                .addEdge(edge("ab", "a", "b", 3L));
        assertEquals(1, ContributionGraph.merge(List.of(edgeOnly, nodesOnly)).edgeCount());
    }

    @Test
    @DisplayName("Merge conflicts fail")
    void testMergeConflict() {
        ContributionGraph left = new ContributionGraph().addNode(node("a", 1L));
        ContributionGraph right = new ContributionGraph().addNode(node("a", 2L));
        CredRankException ex = assertThrows(CredRankException.class, () -> ContributionGraph.merge(List.of(left, right)));
        assertEquals(CredRankException.REASON_MERGE_CONFLICT, ex.getReasonCode());
    }

    private static List<EdgeAddress> addresses(List<Edge> edges) {
        return edges.stream().map(Edge::address).toList();
    }
}
