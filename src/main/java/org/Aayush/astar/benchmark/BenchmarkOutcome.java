package org.Aayush.astar.benchmark;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Result slot for one input graph: exactly one of {@code record} and {@code failure} is set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BenchmarkOutcome {
    BenchmarkRecord record;
    BenchmarkFailure failure;

    public static BenchmarkOutcome succeeded(BenchmarkRecord record) {
        return new BenchmarkOutcome(Objects.requireNonNull(record, "record"), null);
    }

    public static BenchmarkOutcome failed(BenchmarkFailure failure) {
        return new BenchmarkOutcome(null, java.util.Objects.requireNonNull(failure, "failure"));
    }

    public boolean isFailure() {
        return failure != null;
    }

    public String graphName() {
        return isFailure() ? failure.getGraphName() : record.getGraphName();
    }
}
