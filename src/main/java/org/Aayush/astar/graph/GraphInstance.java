package org.Aayush.astar.graph;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One named benchmark input: a graph plus the designated start and goal nodes.
 *
 * <p>{@code startNode}/{@code goalNode} are carried as loaded; range checks happen when the
 * search binds them, so a bad instance fails on its own without affecting its siblings.</p>
 */
@Value
@Builder
public class GraphInstance {
    /** Human-readable name used in reports. */
    @NonNull
    String name;
    @NonNull
    WeightedGraph graph;
    int startNode;
    int goalNode;

    public int nodeCount() {
        return graph.nodeCount();
    }
}
