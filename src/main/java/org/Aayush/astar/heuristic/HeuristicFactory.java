package org.Aayush.astar.heuristic;

import lombok.experimental.UtilityClass;
import org.Aayush.astar.graph.WeightedGraph;

/**
 * Heuristic provider factory.
 *
 * <p>Centralizes validation so every provider is created against the same graph contract and
 * fails with deterministic reason codes.</p>
 */
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "H_TYPE_REQUIRED";
    public static final String REASON_TYPE_UNKNOWN = "H_TYPE_UNKNOWN";
    public static final String REASON_GRAPH_REQUIRED = "H_GRAPH_REQUIRED";

    /**
     * Creates a heuristic provider.
     *
     * @param type requested heuristic type.
     * @param graph graph the provider estimates over.
     * @return initialized heuristic provider.
     * @throws HeuristicConfigurationException if type or graph is missing.
     */
    public static HeuristicProvider create(HeuristicType type, WeightedGraph graph) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, EUCLIDEAN, MANHATTAN)"
            );
        }
        if (graph == null) {
            throw new HeuristicConfigurationException(
                    REASON_GRAPH_REQUIRED,
                    "graph must be provided"
            );
        }

        return switch (type) {
            case NONE -> new NullHeuristicProvider(graph);
            case EUCLIDEAN -> new EuclideanHeuristicProvider(graph);
            case MANHATTAN -> new ManhattanHeuristicProvider(graph);
        };
    }
}
