package org.Aayush.astar.heuristic;

/**
 * Goal-bound heuristic estimator.
 *
 * <p>Hot path contract: {@link #estimateFromNode(int)} is called once per push during search
 * and must avoid allocations. Returned values are finite and non-negative.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Constant zero estimator. Turns A* into Dijkstra.
     */
    GoalBoundHeuristic ZERO = nodeId -> 0.0d;

    /**
     * Estimates remaining cost from a node to the pre-bound goal.
     *
     * @param nodeId source node id.
     * @return estimate of the remaining cost; admissible estimators never overestimate it.
     */
    double estimateFromNode(int nodeId);
}
