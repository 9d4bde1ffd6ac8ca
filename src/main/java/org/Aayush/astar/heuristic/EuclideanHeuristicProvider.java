package org.Aayush.astar.heuristic;

import org.Aayush.astar.graph.WeightedGraph;

import java.util.Objects;

/**
 * Euclidean heuristic provider.
 *
 * <p>Uses straight-line (L2) distance in graph coordinate space, the default estimator of the
 * benchmark. Admissible and consistent for graphs whose edge weights are at least the
 * straight-line length of the edge.</p>
 */
public final class EuclideanHeuristicProvider implements HeuristicProvider {
    private final WeightedGraph graph;

    /**
     * Creates an Euclidean heuristic provider.
     *
     * @param graph graph supplying node coordinates.
     */
    public EuclideanHeuristicProvider(WeightedGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.EUCLIDEAN;
    }

    /**
     * Binds this provider to one goal node and returns a reusable estimator.
     *
     * @param goalNodeId goal node id.
     * @return goal-bound heuristic estimator.
     */
    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        validateGoalNodeId(graph, goalNodeId);
        return new BoundEuclideanHeuristic(graph, graph.getNodeX(goalNodeId), graph.getNodeY(goalNodeId));
    }

    static void validateGoalNodeId(WeightedGraph graph, int goalNodeId) {
        if (!graph.containsNode(goalNodeId)) {
            throw new IllegalArgumentException(
                    "goalNodeId out of bounds: " + goalNodeId + " [0, " + graph.nodeCount() + ")"
            );
        }
    }

    private static final class BoundEuclideanHeuristic implements GoalBoundHeuristic {
        private final WeightedGraph graph;
        private final double goalX;
        private final double goalY;

        private BoundEuclideanHeuristic(WeightedGraph graph, double goalX, double goalY) {
            this.graph = graph;
            this.goalX = goalX;
            this.goalY = goalY;
        }

        @Override
        public double estimateFromNode(int nodeId) {
            if (!graph.containsNode(nodeId)) {
                throw new IllegalArgumentException(
                        "nodeId out of bounds: " + nodeId + " [0, " + graph.nodeCount() + ")"
                );
            }
            double distance = GeometryDistance.euclideanDistance(
                    graph.getNodeX(nodeId),
                    graph.getNodeY(nodeId),
                    goalX,
                    goalY
            );
            return GeometryDistance.sanitize(distance);
        }
    }
}
