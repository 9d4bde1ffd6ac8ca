package org.Aayush.astar.report;

import org.Aayush.astar.benchmark.BenchmarkFailure;
import org.Aayush.astar.benchmark.BenchmarkOutcome;
import org.Aayush.astar.benchmark.BenchmarkRecord;
import org.Aayush.astar.benchmark.SuiteResult;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes benchmark results as a human-readable console report.
 *
 * <p>Numbers are formatted with {@link Locale#ROOT} so the report does not depend on the
 * machine's locale.</p>
 */
public final class ConsoleReportWriter {
    static final String SEPARATOR = "----------------------------------------";
    static final String NO_GRAPHS_MESSAGE = "No valid graph files found in the folder.";

    private static final double NANOS_PER_MILLI = 1_000_000.0d;

    private final PrintStream out;

    public ConsoleReportWriter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void write(SuiteResult result) {
        Objects.requireNonNull(result, "result");
        if (result.isEmpty()) {
            out.println(NO_GRAPHS_MESSAGE);
            return;
        }
        for (BenchmarkOutcome outcome : result.getOutcomes()) {
            if (outcome.isFailure()) {
                write(outcome.getFailure());
            } else {
                write(outcome.getRecord());
            }
        }
        out.flush();
    }

    public void write(BenchmarkRecord row) {
        out.println("Processing graph: " + row.getGraphName());
        out.println("Number of nodes: " + row.getNumNodes());
        out.println("Start node: " + row.getStartNode() + ", Goal node: " + row.getGoalNode());
        out.println();

        out.println("Using " + row.getHeuristicType().displayName() + " heuristic:");
        out.printf(Locale.ROOT, "Average nodes expanded: %.2f, Average steps: %.2f%n",
                row.getAvgNodesExpanded(), row.getAvgSteps());
        out.printf(Locale.ROOT, "Average execution time: %.9f ms (%.9f ns)%n",
                row.getAvgTimeNs() / NANOS_PER_MILLI, row.getAvgTimeNs());
        out.printf(Locale.ROOT, "Min execution time: %.9f ms%n",
                row.getMinTimeNs() / NANOS_PER_MILLI);
        out.printf(Locale.ROOT, "Path cost to goal: %.9f%n", row.getPathCost());
        out.println();
        out.println(SEPARATOR);
    }

    public void write(BenchmarkFailure failure) {
        out.println("Skipped graph: " + failure.getGraphName() + " " + failure.getMessage());
        out.println(SEPARATOR);
    }
}
