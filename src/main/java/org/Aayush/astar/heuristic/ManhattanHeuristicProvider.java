package org.Aayush.astar.heuristic;

import org.Aayush.astar.graph.WeightedGraph;

import java.util.Objects;

/**
 * Manhattan (L1) heuristic provider.
 *
 * <p>Not admissible in general: on graphs with diagonal edges weighted by their Euclidean
 * length it can overestimate, and A* may then report a non-optimal cost. Intended for
 * comparison runs on axis-aligned graphs.</p>
 */
public final class ManhattanHeuristicProvider implements HeuristicProvider {
    private final WeightedGraph graph;

    public ManhattanHeuristicProvider(WeightedGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.MANHATTAN;
    }

    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        EuclideanHeuristicProvider.validateGoalNodeId(graph, goalNodeId);
        double goalX = graph.getNodeX(goalNodeId);
        double goalY = graph.getNodeY(goalNodeId);
        return nodeId -> {
            if (!graph.containsNode(nodeId)) {
                throw new IllegalArgumentException(
                        "nodeId out of bounds: " + nodeId + " [0, " + graph.nodeCount() + ")"
                );
            }
            return GeometryDistance.sanitize(GeometryDistance.manhattanDistance(
                    graph.getNodeX(nodeId),
                    graph.getNodeY(nodeId),
                    goalX,
                    goalY
            ));
        };
    }
}
