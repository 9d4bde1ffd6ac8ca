package org.Aayush.astar.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Insert-only min-priority queue of {@code (node, cost, priority)} entries for A*.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Lazy Deletion:</strong> There is no decrease-key. A node may be present several times
 * with different costs; the search discards outdated entries when they surface.</li>
 * <li><strong>Zero Allocation:</strong> Entries live in pre-sized primitive parallel arrays, so the
 * hot path creates no objects.</li>
 * <li><strong>Strict Contracts:</strong> Capacity is fixed; exceeding it means the caller's bound
 * on pushes was wrong, and fails fast.</li>
 * </ul>
 * </p>
 * <p>Ties on priority are broken by heap position, which is deterministic for a fixed insertion
 * sequence but not stable.</p>
 * <p><strong>Usage Warning:</strong> NOT thread-safe.</p>
 */
public class SearchQueue {

    // Binary heap, 1-based indexing for parent/child math. Slot 0 unused.
    private final int[] nodes;
    private final double[] costs;
    private final double[] priorities;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // Entries inserted over the queue's lifetime, reported as the search's push count.
    @Getter
    private long insertCount = 0;

    /**
     * @param capacity maximum number of entries held at once. Must be positive.
     * @throws IllegalArgumentException if capacity is not positive.
     */
    public SearchQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.nodes = new int[capacity + 1];
        this.costs = new double[capacity + 1];
        this.priorities = new double[capacity + 1];
    }

    /**
     * Inserts a new entry. Existing entries for the same node are left in place.
     *
     * @param node     node id.
     * @param cost     accumulated cost {@code g}.
     * @param priority ordering key {@code f = g + h}.
     * @throws IllegalStateException if the queue is full.
     */
    public void insert(int node, double cost, double priority) {
        if (size >= nodes.length - 1) {
            throw new IllegalStateException("Heap full. Increase capacity (" + (nodes.length - 1) + ").");
        }
        size++;
        nodes[size] = node;
        costs[size] = cost;
        priorities[size] = priority;
        swim(size);

        insertCount++;
    }

    /**
     * @return node of the minimum-priority entry.
     * @throws EmptyQueueException if queue is empty.
     */
    public int minNode() {
        requireNonEmpty();
        return nodes[1];
    }

    /**
     * @return cost {@code g} of the minimum-priority entry.
     * @throws EmptyQueueException if queue is empty.
     */
    public double minCost() {
        requireNonEmpty();
        return costs[1];
    }

    /**
     * @return priority {@code f} of the minimum-priority entry.
     * @throws EmptyQueueException if queue is empty.
     */
    public double minPriority() {
        requireNonEmpty();
        return priorities[1];
    }

    /**
     * Removes the minimum-priority entry.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    public void removeMin() {
        requireNonEmpty();
        if (size == 1) {
            size = 0;
            return;
        }
        move(size, 1);
        size--;
        sink(1);
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private void requireNonEmpty() {
        if (size == 0) {
            throw new EmptyQueueException("Queue is empty");
        }
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && priorities[k / 2] > priorities[k]) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && priorities[j] > priorities[j + 1]) j++;
            if (priorities[k] <= priorities[j]) break;
            swap(k, j);
            k = j;
        }
    }

    private void move(int from, int to) {
        nodes[to] = nodes[from];
        costs[to] = costs[from];
        priorities[to] = priorities[from];
    }

    private void swap(int i, int j) {
        int n = nodes[i];
        nodes[i] = nodes[j];
        nodes[j] = n;

        double c = costs[i];
        costs[i] = costs[j];
        costs[j] = c;

        double p = priorities[i];
        priorities[i] = priorities[j];
        priorities[j] = p;
    }
}
