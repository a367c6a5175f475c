package org.credrank.cred;

import org.credrank.core.CredRankException;
import org.credrank.core.address.NodeAddress;
import org.credrank.graph.ContributionGraph;
import org.credrank.markov.MarkovEdge;
import org.credrank.markov.MarkovProcessGraph;
import org.credrank.markov.MarkovProcessGraphBuilder;
import org.credrank.solver.StationaryDistribution;
import org.credrank.solver.StationaryDistributionSolver;
import org.credrank.testutil.CredRankFixtures;
import org.credrank.testutil.CredRankFixtures.Scenario;
import org.credrank.weights.WeightTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.credrank.testutil.CredRankFixtures.SCENARIO_PARAMETERS;
import static org.credrank.testutil.CredRankFixtures.edge;
import static org.credrank.testutil.CredRankFixtures.intervals;
import static org.credrank.testutil.CredRankFixtures.node;
import static org.credrank.testutil.CredRankFixtures.nodeAddress;
import static org.credrank.testutil.CredRankFixtures.resolver;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CredGraph Tests")
class CredGraphTest {
    private static final NodeAddress DEPENDENCY = nodeAddress("dep");

    private Scenario scenario;
    private CredGraph credGraph;

    @BeforeEach
    void setUp() {
        scenario = CredRankFixtures.scenarioD();
        scenario.graph().addNode(node("dep", null));
        credGraph = solve(scenario);
    }

    private static CredGraph solve(Scenario scenario) {
        MarkovProcessGraph mpg = MarkovProcessGraphBuilder.build(
                scenario.graph(),
                resolver(scenario.weights()),
                scenario.intervals(),
                scenario.participants(),
                SCENARIO_PARAMETERS
        );
        StationaryDistribution distribution = StationaryDistributionSolver.solve(mpg.toMarkovChain());
        return CredGraph.fromStationaryDistribution(mpg, distribution);
    }

    private static DependencyMintPolicy sinceForever(NodeAddress recipient, double weight) {
        return new DependencyMintPolicy(
                recipient,
                List.of(new DependencyMintPeriod(weight, DependencyMintPeriod.SINCE_FOREVER))
        );
    }

    @Test
    @DisplayName("Scores are rescaled so that non-seed nodes hold the total mint")
    void testScaling() {
        double[] scores = credGraph.scores();
        double nonSeed = 0.0d;
        for (int i = 1; i < scores.length; i++) {
            nonSeed += scores[i];
        }
        assertEquals(1.0d, nonSeed, 1e-9);
        assertEquals(nonSeed, credGraph.totalCred(), 1e-12);
        assertTrue(scores[0] > 0.0d);
        assertEquals(0.0d, credGraph.nodeCred(0));
        assertEquals(0.0d, credGraph.nodeCred(DEPENDENCY));
    }

    @Test
    @DisplayName("Node and edge views follow the MPG order")
    void testViews() {
        MarkovProcessGraph mpg = credGraph.markovProcessGraph();
        List<CredNode> nodes = credGraph.nodes();
        List<CredEdge> edges = credGraph.edges();
        assertEquals(mpg.nodeCount(), nodes.size());
        assertEquals(mpg.edgeCount(), edges.size());
        for (int i = 0; i < nodes.size(); i++) {
            assertEquals(mpg.node(i), nodes.get(i).node());
            assertEquals(credGraph.nodeCred(i), nodes.get(i).cred());
        }
        for (int e = 0; e < edges.size(); e++) {
            MarkovEdge edge = edges.get(e).edge();
            assertEquals(credGraph.scores()[edge.src()] * edge.transitionProbability(), edges.get(e).credFlow());
        }
        assertEquals(scenario.intervals(), credGraph.intervals());
        assertThrows(IllegalArgumentException.class, () -> credGraph.nodeCred(nodeAddress("nowhere")));
    }

    @Test
    @DisplayName("Minted Cred is the mint of nodes created in each interval")
    void testMintedCredPerInterval() {
        assertArrayEquals(new double[]{0.0d, 1.0d, 0.0d}, credGraph.mintedCredPerInterval());
    }

    @Test
    @DisplayName("Dependency mint is weight times minted Cred per interval")
    void testDependencyMint() {
        CredGraph withMint = credGraph.withDependencyMint(List.of(sinceForever(DEPENDENCY, 0.5d)));

        assertArrayEquals(new double[]{0.0d, 0.5d, 0.0d}, withMint.dependencyCredPerInterval(DEPENDENCY));
        assertEquals(0.5d, withMint.nodeCred(DEPENDENCY), 1e-15);
        assertEquals(credGraph.totalCred() + 0.5d, withMint.totalCred(), 1e-12);
        assertEquals(List.of(DEPENDENCY), withMint.dependencyRecipients());
        assertArrayEquals(credGraph.scores(), withMint.scores());
        assertNotEquals(credGraph, withMint);

        assertArrayEquals(new double[3], credGraph.dependencyCredPerInterval(DEPENDENCY));
        assertTrue(credGraph.dependencyRecipients().isEmpty());
    }

    @Test
    @DisplayName("A full-weight dependency mints as much as the graph minted")
    void testFullWeightDependencyMint() {
        Scenario b = CredRankFixtures.scenarioB();
        b.graph().addNode(node("dep", null));
        CredGraph base = solve(b);
        assertEquals(3.0d, base.totalCred(), 1e-9);

        CredGraph withMint = base.withDependencyMint(List.of(sinceForever(DEPENDENCY, 1.0d)));

        assertArrayEquals(new double[]{0.0d, 3.0d, 0.0d}, withMint.dependencyCredPerInterval(DEPENDENCY));
        assertEquals(3.0d, withMint.nodeCred(DEPENDENCY), 1e-12);
        assertEquals(6.0d, withMint.totalCred(), 1e-9);
    }

    @Test
    @DisplayName("Each interval mints from its own nodes only")
    void testDependencyMintAcrossIntervals() {
        ContributionGraph graph = new ContributionGraph()
                .addNode(node("A", 0L))
                .addNode(node("B", 3L))
                .addNode(node("late", 10L))
                .addNode(node("dep", null))
                .addEdge(edge("a-b", "A", "B", 0L))
                .addEdge(edge("b-a", "B", "A", 3L));
        WeightTable weights = WeightTable.builder()
                .nodeWeight(nodeAddress("A"), 1.0d)
                .nodeWeight(nodeAddress("B"), 2.0d)
                .nodeWeight(nodeAddress("late"), 4.0d)
                .build();
        CredGraph base = solve(new Scenario(graph, weights, List.of(), intervals(graph, 2L)));

        double[] minted = base.mintedCredPerInterval();
        assertArrayEquals(new double[]{0.0d, 1.0d, 2.0d, 4.0d}, minted);
        assertEquals(base.totalCred(), minted[0] + minted[1] + minted[2] + minted[3], 1e-9);

        CredGraph withMint = base.withDependencyMint(List.of(sinceForever(DEPENDENCY, 0.25d)));
        assertArrayEquals(new double[]{0.0d, 0.25d, 0.5d, 1.0d}, withMint.dependencyCredPerInterval(DEPENDENCY));
        assertEquals(1.75d, withMint.nodeCred(DEPENDENCY), 1e-12);
    }

    @Test
    @DisplayName("Applying policies again replaces earlier dependency mint")
    void testDependencyMintReplaces() {
        CredGraph once = credGraph.withDependencyMint(List.of(sinceForever(DEPENDENCY, 0.5d)));
        CredGraph twice = once.withDependencyMint(List.of(sinceForever(DEPENDENCY, 0.25d)));
        assertEquals(credGraph.withDependencyMint(List.of(sinceForever(DEPENDENCY, 0.25d))), twice);
        assertEquals(credGraph, once.withDependencyMint(List.of()));
    }

    @Test
    @DisplayName("Dependency mint periods starting later only mint from then on")
    void testDependencyMintLaterPeriod() {
        DependencyMintPolicy policy = new DependencyMintPolicy(
                DEPENDENCY,
                List.of(new DependencyMintPeriod(1.0d, 2L))
        );
        CredGraph withMint = credGraph.withDependencyMint(List.of(policy));
        assertArrayEquals(new double[3], withMint.dependencyCredPerInterval(DEPENDENCY));
    }

    @Test
    @DisplayName("Recipients must be graph nodes")
    void testUnknownRecipient() {
        CredRankException ex = assertThrows(
                CredRankException.class,
                () -> credGraph.withDependencyMint(List.of(sinceForever(nodeAddress("missing"), 0.1d)))
        );
        assertEquals(CredRankException.REASON_UNKNOWN_RECIPIENT, ex.getReasonCode());

        CredRankException direct = assertThrows(
                CredRankException.class,
                () -> new CredGraph(
                        credGraph.markovProcessGraph(),
                        credGraph.scores(),
                        Map.of(nodeAddress("missing"), new double[3])
                )
        );
        assertEquals(CredRankException.REASON_UNKNOWN_RECIPIENT, direct.getReasonCode());
    }

    @Test
    @DisplayName("A recipient may have only one policy")
    void testDuplicatePolicy() {
        CredRankException ex = assertThrows(
                CredRankException.class,
                () -> credGraph.withDependencyMint(List.of(
                        sinceForever(DEPENDENCY, 0.1d),
                        sinceForever(DEPENDENCY, 0.2d)
                ))
        );
        assertEquals(CredRankException.REASON_POLICY_ERROR, ex.getReasonCode());
    }

    @Test
    @DisplayName("Score arrays must match the graph")
    void testScoreValidation() {
        MarkovProcessGraph mpg = credGraph.markovProcessGraph();
        assertThrows(IllegalArgumentException.class, () -> new CredGraph(mpg, new double[1], Map.of()));
        double[] negative = credGraph.scores();
        negative[1] = -1.0d;
        assertThrows(IllegalArgumentException.class, () -> new CredGraph(mpg, negative, Map.of()));
        assertThrows(
                IllegalArgumentException.class,
                () -> new CredGraph(mpg, credGraph.scores(), Map.of(DEPENDENCY, new double[1]))
        );
    }
}
