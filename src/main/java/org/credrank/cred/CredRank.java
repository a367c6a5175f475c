package org.credrank.cred;

import lombok.extern.slf4j.Slf4j;
import org.credrank.core.time.IntervalPartitioner;
import org.credrank.core.time.IntervalSequence;
import org.credrank.graph.ContributionGraph;
import org.credrank.markov.MarkovProcessGraph;
import org.credrank.markov.MarkovProcessGraphBuilder;
import org.credrank.markov.Parameters;
import org.credrank.markov.Participant;
import org.credrank.markov.PersonalAttributions;
import org.credrank.solver.SolverOptions;
import org.credrank.solver.StationaryDistribution;
import org.credrank.solver.StationaryDistributionSolver;
import org.credrank.weights.DeclarationRegistry;
import org.credrank.weights.PluginDeclaration;
import org.credrank.weights.WeightResolver;
import org.credrank.weights.WeightTable;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Entry point: contribution graph in, Cred out.
 *
 * <p>Validates that the declarations claim every address, seals the graph, builds
 * the Markov process graph, solves for its stationary distribution and projects
 * the result into a {@link CredGraph}.</p>
 */
@Slf4j
public final class CredRank {

    private CredRank() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Computes Cred over Sunday-aligned weekly intervals derived from the graph's edge timestamps.
     */
    public static CredGraph compute(
            ContributionGraph graph,
            WeightTable weights,
            Collection<PluginDeclaration> declarations,
            List<Participant> participants,
            Parameters parameters
    ) {
        Objects.requireNonNull(graph, "graph");
        return compute(
                graph,
                weights,
                declarations,
                participants,
                parameters,
                IntervalPartitioner.weekly(graph)
        );
    }

    public static CredGraph compute(
            ContributionGraph graph,
            WeightTable weights,
            Collection<PluginDeclaration> declarations,
            List<Participant> participants,
            Parameters parameters,
            IntervalSequence intervals
    ) {
        return compute(
                graph,
                weights,
                declarations,
                participants,
                parameters,
                intervals,
                SolverOptions.defaults(),
                PersonalAttributions.empty()
        );
    }

    /**
     * Full form.
     *
     * @throws org.credrank.core.CredRankException {@code UNCLAIMED_ADDRESS}, {@code CONSTRUCTION_ERROR},
     *                                             {@code PARAMETER_ERROR} or {@code NONCONVERGENT}.
     */
    public static CredGraph compute(
            ContributionGraph graph,
            WeightTable weights,
            Collection<PluginDeclaration> declarations,
            List<Participant> participants,
            Parameters parameters,
            IntervalSequence intervals,
            SolverOptions options,
            PersonalAttributions attributions
    ) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(declarations, "declarations");
        Objects.requireNonNull(options, "options");
        long startNanos = System.nanoTime();

        DeclarationRegistry registry = new DeclarationRegistry(declarations);
        registry.validateCoverage(graph);
        graph.seal();
        WeightResolver resolver = new WeightResolver(registry, weights);

        MarkovProcessGraph mpg = MarkovProcessGraphBuilder.build(
                graph,
                resolver,
                intervals,
                participants,
                parameters,
                attributions
        );
        StationaryDistribution distribution = StationaryDistributionSolver.solve(mpg.toMarkovChain(), options);
        CredGraph credGraph = CredGraph.fromStationaryDistribution(mpg, distribution);

        log.info(
                "credrank: {} nodes, {} edges, {} intervals, {} participants, {} iterations, total cred {} in {} ms",
                mpg.nodeCount(),
                mpg.edgeCount(),
                mpg.intervals().size(),
                mpg.participants().size(),
                distribution.iterations(),
                credGraph.totalCred(),
                (System.nanoTime() - startNanos) / 1_000_000L
        );
        return credGraph;
    }
}
