package org.Aayush.astar.app;

import org.Aayush.astar.benchmark.BenchmarkConfig;
import org.Aayush.astar.benchmark.BenchmarkSuite;
import org.Aayush.astar.benchmark.SuiteResult;
import org.Aayush.astar.graph.GraphInstance;
import org.Aayush.astar.heuristic.HeuristicConfigurationException;
import org.Aayush.astar.io.GraphDirectoryScanner;
import org.Aayush.astar.io.GraphFormatException;
import org.Aayush.astar.report.ConsoleReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point: benchmarks every graph file in a folder and prints the report.
 * <p>
 * Usage: {@code java -Dastarbench.runs=100 -Dastarbench.heuristic=EUCLIDEAN -jar astar-bench.jar [graphsFolder]}
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    /**
     * @param args optional graphs folder; defaults to {@code astarbench.graphsDir} or {@code graphs}.
     */
    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs the benchmark and writes the report to {@code out}.
     *
     * @return process exit status.
     */
    static int run(String[] args, PrintStream out) {
        BenchmarkConfig config;
        try {
            config = BenchmarkConfig.fromSystemProperties();
        } catch (HeuristicConfigurationException | IllegalArgumentException ex) {
            log.error("Invalid configuration: {}", ex.getMessage());
            return EXIT_FAILURE;
        }
        if (args != null && args.length > 0) {
            config = config.withGraphsDirectory(args[0]);
        }

        Path folder = Paths.get(config.getGraphsDirectory());
        List<GraphInstance> graphs;
        try {
            graphs = new GraphDirectoryScanner().scan(folder);
        } catch (GraphFormatException ex) {
            log.error("Cannot load graphs: {}", ex.getMessage());
            return EXIT_FAILURE;
        }

        SuiteResult result = new BenchmarkSuite(config).run(graphs);
        new ConsoleReportWriter(out).write(result);
        return EXIT_OK;
    }
}
