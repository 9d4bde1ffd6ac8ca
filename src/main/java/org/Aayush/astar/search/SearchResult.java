package org.Aayush.astar.search;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one A* search.
 *
 * <p>When the goal is unreachable {@code pathCost} is {@link #UNREACHABLE_COST}.</p>
 */
@Value
@Builder
public class SearchResult {
    /** Path cost reported for an unreachable goal. */
    public static final double UNREACHABLE_COST = -1.0d;

    /** Minimum start-to-goal cost, or {@link #UNREACHABLE_COST}. */
    double pathCost;
    /** Non-stale removals from the working set, the goal included when reached. */
    int nodesExpanded;
    /** Every removal from the working set, stale ones included. */
    int steps;
    /** Entries pushed into the working set, the start entry included. */
    int pushes;

    public boolean isReachable() {
        return pathCost != UNREACHABLE_COST;
    }
}
