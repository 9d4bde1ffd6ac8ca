package org.Aayush.astar.benchmark;

import lombok.Builder;
import lombok.Value;
import org.Aayush.astar.heuristic.HeuristicType;

/**
 * Benchmark configuration, bound once at startup.
 *
 * <p>Unset builder fields take the defaults below. {@link #fromSystemProperties()} reads the
 * {@code astarbench.*} properties; blank or unparsable values fall back to defaults.</p>
 */
@Value
public class BenchmarkConfig {
    public static final String PROP_RUNS = "astarbench.runs";
    public static final String PROP_WARMUP_RUNS = "astarbench.warmupRuns";
    public static final String PROP_HEURISTIC = "astarbench.heuristic";
    public static final String PROP_GRAPHS_DIR = "astarbench.graphsDir";

    public static final int DEFAULT_WARMUP_RUNS = 0;
    public static final HeuristicType DEFAULT_HEURISTIC = HeuristicType.EUCLIDEAN;
    public static final String DEFAULT_GRAPHS_DIR = "graphs";

    /** Measured runs per graph. */
    int runs;
    /** Unmeasured runs per graph executed before measuring. */
    int warmupRuns;
    HeuristicType heuristicType;
    /** Folder scanned for {@code *.txt} graph files. */
    String graphsDirectory;

    @Builder
    private BenchmarkConfig(Integer runs, Integer warmupRuns, HeuristicType heuristicType, String graphsDirectory) {
        this.runs = runs == null ? BenchmarkHarness.DEFAULT_RUNS : runs;
        this.warmupRuns = warmupRuns == null ? DEFAULT_WARMUP_RUNS : warmupRuns;
        this.heuristicType = heuristicType == null ? DEFAULT_HEURISTIC : heuristicType;
        this.graphsDirectory = graphsDirectory == null || graphsDirectory.isBlank()
                ? DEFAULT_GRAPHS_DIR
                : graphsDirectory;

        if (this.runs < 1) {
            throw new IllegalArgumentException("runs must be >= 1, got " + this.runs);
        }
        if (this.warmupRuns < 0) {
            throw new IllegalArgumentException("warmupRuns must be >= 0, got " + this.warmupRuns);
        }
    }

    /**
     * @return configuration with every default.
     */
    public static BenchmarkConfig defaults() {
        return BenchmarkConfig.builder().build();
    }

    /**
     * Loads configuration from system properties.
     *
     * @throws IllegalArgumentException if a parsed count is out of range.
     * @throws org.Aayush.astar.heuristic.HeuristicConfigurationException if the heuristic is unknown.
     */
    public static BenchmarkConfig fromSystemProperties() {
        String heuristic = System.getProperty(PROP_HEURISTIC);
        return BenchmarkConfig.builder()
                .runs(readInt(PROP_RUNS))
                .warmupRuns(readInt(PROP_WARMUP_RUNS))
                .heuristicType(heuristic == null || heuristic.isBlank() ? null : HeuristicType.parse(heuristic))
                .graphsDirectory(System.getProperty(PROP_GRAPHS_DIR))
                .build();
    }

    /**
     * Copy with a different graphs folder, used when the folder is given on the command line.
     */
    public BenchmarkConfig withGraphsDirectory(String directory) {
        return new BenchmarkConfig(runs, warmupRuns, heuristicType, directory);
    }

    private static Integer readInt(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
