package org.Aayush.astar.benchmark;

import lombok.Value;

/**
 * A graph that could not be benchmarked, with the reason code of the failure.
 */
@Value
public class BenchmarkFailure {
    String graphName;
    String reasonCode;
    /** Exception message, already prefixed with {@code [reasonCode]}. */
    String message;
}
