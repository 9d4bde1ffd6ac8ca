package org.Aayush.astar.search;

import org.Aayush.astar.graph.WeightedGraph;
import org.Aayush.astar.heuristic.GoalBoundHeuristic;

import java.util.Arrays;

/**
 * Single-goal A* over a {@link WeightedGraph}.
 * <p>
 * The working set is an insert-only {@link SearchQueue}: improved costs are pushed as new entries
 * and an entry whose cost exceeds the node's current best distance is skipped when popped.
 * Closed nodes are never pushed again, which is only correct for non-negative edge weights
 * (guaranteed by {@link WeightedGraph.Builder}).
 * <p>
 * Every push strictly lowers the distance of a node that is not closed, and each node is closed
 * at most once, so a search performs at most {@code arcCount + 1} pushes and always terminates.
 * <p>
 * Stateless and reusable; all search state is allocated per call.
 */
public final class AStarSearch {

    public static final String REASON_GRAPH_REQUIRED = "S_GRAPH_REQUIRED";
    public static final String REASON_GRAPH_EMPTY = "S_GRAPH_EMPTY";
    public static final String REASON_HEURISTIC_REQUIRED = "S_HEURISTIC_REQUIRED";
    public static final String REASON_START_OUT_OF_RANGE = "S_START_OUT_OF_RANGE";
    public static final String REASON_GOAL_OUT_OF_RANGE = "S_GOAL_OUT_OF_RANGE";
    public static final String REASON_HEURISTIC_INVALID = "S_HEURISTIC_INVALID";

    /**
     * Runs one search from {@code start} to {@code goal}.
     *
     * @param graph     graph to search; read only.
     * @param start     start node.
     * @param goal      goal node.
     * @param heuristic estimator bound to {@code goal}.
     * @return path cost and work counters.
     * @throws SearchContractException if the graph is missing or empty, an endpoint is out of
     *                                 range, or the heuristic yields a negative or NaN estimate.
     */
    public SearchResult search(WeightedGraph graph, int start, int goal, GoalBoundHeuristic heuristic) {
        validate(graph, start, goal, heuristic);

        int nodeCount = graph.nodeCount();
        double[] distance = new double[nodeCount];
        Arrays.fill(distance, Double.POSITIVE_INFINITY);
        VisitedSet closed = new VisitedSet(nodeCount);
        SearchQueue open = new SearchQueue(graph.arcCount() + 1);

        distance[start] = 0.0d;
        open.insert(start, 0.0d, estimate(heuristic, start));

        int nodesExpanded = 0;
        int steps = 0;

        while (!open.isEmpty()) {
            int node = open.minNode();
            double g = open.minCost();
            open.removeMin();
            steps++;

            if (g > distance[node]) {
                continue; // stale
            }

            nodesExpanded++;
            if (node == goal) {
                break;
            }
            closed.markVisited(node);

            int end = graph.arcEnd(node);
            for (int arc = graph.firstArc(node); arc < end; arc++) {
                int nbr = graph.getArcTarget(arc);
                double newG = g + graph.getArcWeight(arc);
                if (newG < distance[nbr] && !closed.isVisited(nbr)) {
                    distance[nbr] = newG;
                    open.insert(nbr, newG, newG + estimate(heuristic, nbr));
                }
            }
        }

        double goalDistance = distance[goal];
        return SearchResult.builder()
                .pathCost(goalDistance == Double.POSITIVE_INFINITY ? SearchResult.UNREACHABLE_COST : goalDistance)
                .nodesExpanded(nodesExpanded)
                .steps(steps)
                .pushes((int) open.getInsertCount())
                .build();
    }

    private static double estimate(GoalBoundHeuristic heuristic, int node) {
        double h = heuristic.estimateFromNode(node);
        if (!(h >= 0.0d)) {
            throw new SearchContractException(
                    REASON_HEURISTIC_INVALID,
                    "heuristic estimate for node " + node + " must be non-negative, got " + h
            );
        }
        return h;
    }

    private static void validate(WeightedGraph graph, int start, int goal, GoalBoundHeuristic heuristic) {
        if (graph == null) {
            throw new SearchContractException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        if (graph.isEmpty()) {
            throw new SearchContractException(REASON_GRAPH_EMPTY, "graph has no nodes");
        }
        if (heuristic == null) {
            throw new SearchContractException(REASON_HEURISTIC_REQUIRED, "heuristic must be provided");
        }
        if (!graph.containsNode(start)) {
            throw new SearchContractException(
                    REASON_START_OUT_OF_RANGE,
                    "start node " + start + " out of bounds [0, " + graph.nodeCount() + ")"
            );
        }
        if (!graph.containsNode(goal)) {
            throw new SearchContractException(
                    REASON_GOAL_OUT_OF_RANGE,
                    "goal node " + goal + " out of bounds [0, " + graph.nodeCount() + ")"
            );
        }
    }
}
