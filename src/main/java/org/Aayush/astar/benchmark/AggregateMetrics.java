package org.Aayush.astar.benchmark;

import lombok.Builder;
import lombok.Value;

/**
 * Averaged measurements over the measured runs of one benchmark.
 *
 * <p>Warm-up runs never contribute to any field.</p>
 */
@Value
@Builder
public class AggregateMetrics {
    /** Number of measured runs. */
    int runs;
    double avgNodesExpanded;
    double avgSteps;
    /** Mean elapsed time per run, {@code totalTimeNs / runs}. */
    double avgTimeNs;
    long totalTimeNs;
    /** Fastest single run. */
    long minTimeNs;
    /** Slowest single run. */
    long maxTimeNs;
    /** Path cost of the first measured run; the search is deterministic. */
    double pathCost;
}
