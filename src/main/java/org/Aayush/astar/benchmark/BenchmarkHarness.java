package org.Aayush.astar.benchmark;

import org.Aayush.astar.graph.WeightedGraph;
import org.Aayush.astar.heuristic.GoalBoundHeuristic;
import org.Aayush.astar.search.AStarSearch;
import org.Aayush.astar.search.SearchResult;

import java.util.Objects;

/**
 * Repeats one A* search and aggregates its counters and timings.
 * <p>
 * The timed region of each run is exactly the {@link AStarSearch#search} call. Accumulators
 * are local to one {@link #benchmark} call; the harness itself holds no mutable state.
 */
public final class BenchmarkHarness {
    public static final int DEFAULT_RUNS = 100;

    private final AStarSearch search;
    private final NanoClock clock;

    public BenchmarkHarness() {
        this(new AStarSearch(), NanoClock.SYSTEM);
    }

    public BenchmarkHarness(AStarSearch search, NanoClock clock) {
        this.search = Objects.requireNonNull(search, "search");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Benchmarks with {@link #DEFAULT_RUNS} measured runs and no warm-up.
     */
    public AggregateMetrics benchmark(WeightedGraph graph, int start, int goal, GoalBoundHeuristic heuristic) {
        return benchmark(graph, start, goal, heuristic, DEFAULT_RUNS, 0);
    }

    public AggregateMetrics benchmark(
            WeightedGraph graph,
            int start,
            int goal,
            GoalBoundHeuristic heuristic,
            int runs
    ) {
        return benchmark(graph, start, goal, heuristic, runs, 0);
    }

    /**
     * Runs {@code warmupRuns} unmeasured searches, then {@code runs} measured ones.
     *
     * @param runs       measured runs, at least 1.
     * @param warmupRuns unmeasured runs, at least 0.
     * @return aggregate over the measured runs.
     * @throws IllegalArgumentException if {@code runs < 1} or {@code warmupRuns < 0}.
     * @throws org.Aayush.astar.search.SearchContractException on invalid search input.
     * @throws BenchmarkException if the clock fails or goes backwards.
     */
    public AggregateMetrics benchmark(
            WeightedGraph graph,
            int start,
            int goal,
            GoalBoundHeuristic heuristic,
            int runs,
            int warmupRuns
    ) {
        if (runs < 1) {
            throw new IllegalArgumentException("runs must be >= 1, got " + runs);
        }
        if (warmupRuns < 0) {
            throw new IllegalArgumentException("warmupRuns must be >= 0, got " + warmupRuns);
        }

        for (int i = 0; i < warmupRuns; i++) {
            search.search(graph, start, goal, heuristic);
        }

        long totalNanos = 0L;
        long minNanos = Long.MAX_VALUE;
        long maxNanos = 0L;
        long totalNodesExpanded = 0L;
        long totalSteps = 0L;
        double pathCost = SearchResult.UNREACHABLE_COST;

        for (int run = 0; run < runs; run++) {
            long startNanos = readClock();
            SearchResult result = search.search(graph, start, goal, heuristic);
            long endNanos = readClock();

            long elapsed = endNanos - startNanos;
            if (elapsed < 0L) {
                throw new BenchmarkException(
                        BenchmarkException.REASON_CLOCK_NOT_MONOTONIC,
                        "clock went backwards by " + (-elapsed) + " ns during run " + run
                );
            }

            totalNanos += elapsed;
            minNanos = Math.min(minNanos, elapsed);
            maxNanos = Math.max(maxNanos, elapsed);
            totalNodesExpanded += result.getNodesExpanded();
            totalSteps += result.getSteps();

            if (run == 0) {
                pathCost = result.getPathCost();
            }
        }

        return AggregateMetrics.builder()
                .runs(runs)
                .avgNodesExpanded((double) totalNodesExpanded / runs)
                .avgSteps((double) totalSteps / runs)
                .avgTimeNs((double) totalNanos / runs)
                .totalTimeNs(totalNanos)
                .minTimeNs(minNanos)
                .maxTimeNs(maxNanos)
                .pathCost(pathCost)
                .build();
    }

    private long readClock() {
        try {
            return clock.nanoTime();
        } catch (RuntimeException ex) {
            throw new BenchmarkException(BenchmarkException.REASON_CLOCK_FAILURE, "time source unavailable", ex);
        }
    }
}
