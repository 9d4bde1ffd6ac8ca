package org.Aayush.astar.heuristic;

import org.Aayush.astar.graph.WeightedGraph;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore behaves like plain Dijkstra
 * while still honoring the goal bound-check contract.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private final int nodeCount;

    /**
     * Creates a null heuristic provider for one graph.
     *
     * @param graph graph used for goal bound validation.
     */
    public NullHeuristicProvider(WeightedGraph graph) {
        Objects.requireNonNull(graph, "graph");
        this.nodeCount = graph.nodeCount();
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    /**
     * Binds this provider to one goal node.
     *
     * @param goalNodeId goal node id.
     * @return shared zero-cost estimator.
     */
    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        if (goalNodeId < 0 || goalNodeId >= nodeCount) {
            throw new IllegalArgumentException(
                    "goalNodeId out of bounds: " + goalNodeId + " [0, " + nodeCount + ")"
            );
        }
        return GoalBoundHeuristic.ZERO;
    }
}
