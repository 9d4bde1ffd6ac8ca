package org.Aayush.astar.benchmark;

import org.Aayush.astar.graph.GraphInstance;
import org.Aayush.astar.heuristic.GoalBoundHeuristic;
import org.Aayush.astar.heuristic.HeuristicConfigurationException;
import org.Aayush.astar.heuristic.HeuristicFactory;
import org.Aayush.astar.heuristic.HeuristicProvider;
import org.Aayush.astar.search.AStarSearch;
import org.Aayush.astar.search.SearchContractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Benchmarks a sequence of graph instances, one after another.
 * <p>
 * A failure on one instance is recorded and the suite moves on to the next.
 */
public final class BenchmarkSuite {
    private static final Logger log = LoggerFactory.getLogger(BenchmarkSuite.class);

    private final BenchmarkConfig config;
    private final BenchmarkHarness harness;

    public BenchmarkSuite(BenchmarkConfig config) {
        this(config, new BenchmarkHarness());
    }

    public BenchmarkSuite(BenchmarkConfig config, BenchmarkHarness harness) {
        this.config = Objects.requireNonNull(config, "config");
        this.harness = Objects.requireNonNull(harness, "harness");
    }

    public SuiteResult run(List<GraphInstance> instances) {
        Objects.requireNonNull(instances, "instances");
        SuiteResult.SuiteResultBuilder result = SuiteResult.builder();

        for (GraphInstance instance : instances) {
            try {
                result.outcome(BenchmarkOutcome.succeeded(runOne(instance)));
            } catch (SearchContractException ex) {
                result.outcome(fail(instance, ex.getReasonCode(), ex));
            } catch (HeuristicConfigurationException ex) {
                result.outcome(fail(instance, ex.reasonCode(), ex));
            } catch (BenchmarkException ex) {
                result.outcome(fail(instance, ex.reasonCode(), ex));
            }
        }

        SuiteResult built = result.build();
        log.info("Benchmarked {} graph(s), {} failed, {} run(s) each with {} heuristic",
                built.getRecords().size(), built.getFailures().size(),
                config.getRuns(), config.getHeuristicType());
        return built;
    }

    /**
     * Benchmarks one instance with the configured heuristic and run counts.
     */
    public BenchmarkRecord runOne(GraphInstance instance) {
        Objects.requireNonNull(instance, "instance");
        GoalBoundHeuristic heuristic = bindHeuristic(instance);

        AggregateMetrics metrics = harness.benchmark(
                instance.getGraph(),
                instance.getStartNode(),
                instance.getGoalNode(),
                heuristic,
                config.getRuns(),
                config.getWarmupRuns()
        );

        return BenchmarkRecord.builder()
                .graphName(instance.getName())
                .numNodes(instance.nodeCount())
                .startNode(instance.getStartNode())
                .goalNode(instance.getGoalNode())
                .heuristicType(config.getHeuristicType())
                .avgNodesExpanded(metrics.getAvgNodesExpanded())
                .avgSteps(metrics.getAvgSteps())
                .avgTimeNs(metrics.getAvgTimeNs())
                .totalTimeNs(metrics.getTotalTimeNs())
                .minTimeNs(metrics.getMinTimeNs())
                .pathCost(metrics.getPathCost())
                .build();
    }

    private GoalBoundHeuristic bindHeuristic(GraphInstance instance) {
        HeuristicProvider provider = HeuristicFactory.create(config.getHeuristicType(), instance.getGraph());
        try {
            return provider.bindGoal(instance.getGoalNode());
        } catch (IllegalArgumentException ex) {
            // Empty graphs and bad goals are reported with the search's own reason codes.
            if (instance.getGraph().isEmpty()) {
                throw new SearchContractException(AStarSearch.REASON_GRAPH_EMPTY, "graph has no nodes");
            }
            throw new SearchContractException(AStarSearch.REASON_GOAL_OUT_OF_RANGE, ex.getMessage());
        }
    }

    private static BenchmarkOutcome fail(GraphInstance instance, String reasonCode, RuntimeException ex) {
        log.warn("Skipping graph '{}': {}", instance.getName(), ex.getMessage());
        return BenchmarkOutcome.failed(new BenchmarkFailure(instance.getName(), reasonCode, ex.getMessage()));
    }
}
