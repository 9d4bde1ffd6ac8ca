package org.Aayush.astar.benchmark;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcomes of one suite execution, one per input graph, in input order.
 */
@Value
@Builder
public class SuiteResult {
    @Singular
    List<BenchmarkOutcome> outcomes;

    public List<BenchmarkRecord> getRecords() {
        return outcomes.stream()
                .filter(outcome -> !outcome.isFailure())
                .map(BenchmarkOutcome::getRecord)
                .collect(Collectors.toList());
    }

    public List<BenchmarkFailure> getFailures() {
        return outcomes.stream()
                .filter(BenchmarkOutcome::isFailure)
                .map(BenchmarkOutcome::getFailure)
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }
}
