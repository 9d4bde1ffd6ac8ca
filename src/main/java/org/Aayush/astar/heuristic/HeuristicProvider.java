package org.Aayush.astar.heuristic;

/**
 * Heuristic provider contract used by the search engine and benchmark suite.
 *
 * <p>Providers are immutable and thread-safe. Binding returns an immutable goal-bound
 * estimator that can be reused across every benchmark run for that goal.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a concrete goal node and returns a reusable estimator.
     *
     * @param goalNodeId goal node id.
     * @return immutable estimator bound to the provided goal node.
     * @throws IllegalArgumentException if the goal is outside the graph.
     */
    GoalBoundHeuristic bindGoal(int goalNodeId);
}
