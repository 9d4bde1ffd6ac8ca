package org.Aayush.astar.search;

import java.util.BitSet;

/**
 * Closed set of expanded nodes.
 * <p>
 * Wraps a {@link java.util.BitSet}: O(1) access and about one bit per node.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe. Owned by a single search invocation.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param initialCapacity expected number of nodes, to avoid resizing.
     */
    public VisitedSet(int initialCapacity) {
        this.visited = new BitSet(initialCapacity);
    }

    /**
     * Marks a node as visited if it hasn't been visited already.
     *
     * @return {@code true} if the node was NOT previously visited.
     */
    public boolean markVisited(int nodeId) {
        if (visited.get(nodeId)) {
            return false;
        }
        visited.set(nodeId);
        return true;
    }

    public boolean isVisited(int nodeId) {
        return visited.get(nodeId);
    }
}
