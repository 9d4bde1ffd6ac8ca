package org.Aayush.astar.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Locale;

/**
 * Immutable weighted undirected graph embedded in 2D coordinate space.
 * <p>
 * Layout:
 * - SoA (Structure of Arrays) for arc targets, arc weights and node coordinates.
 * - CSR (Compressed Sparse Row) so the arcs of a node are a contiguous index range.
 * - Every undirected edge {@code (u, v, w)} is stored as two arcs, {@code u->v} and {@code v->u}.
 *   Arcs of one node keep the order in which their edges were added.
 * <p>
 * Edge weights are finite and non-negative. The builder enforces this, which is the precondition
 * that lets A* treat a closed node's distance as final.
 * <p>
 * Instances are safe to share between threads and between benchmark runs without copying.
 */
public final class WeightedGraph {

    public static final String REASON_NODE_COUNT_NEGATIVE = "G_NODE_COUNT_NEGATIVE";
    public static final String REASON_NODE_OUT_OF_RANGE = "G_NODE_OUT_OF_RANGE";
    public static final String REASON_WEIGHT_NEGATIVE = "G_WEIGHT_NEGATIVE";
    public static final String REASON_WEIGHT_NON_FINITE = "G_WEIGHT_NON_FINITE";
    public static final String REASON_COORDINATE_NON_FINITE = "G_COORDINATE_NON_FINITE";

    // ========================================================================
    // DATA (SoA Layout)
    // ========================================================================

    // CSR Index: firstArc[node] -> start index in arc arrays, firstArc[nodeCount] == arcCount
    private final int[] firstArc;
    private final int[] arcTarget;
    private final double[] arcWeight;

    private final double[] nodeX;
    private final double[] nodeY;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    /** Number of undirected edges as added to the builder. */
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private WeightedGraph(int nodeCount, int edgeCount,
                          int[] firstArc, int[] arcTarget, double[] arcWeight,
                          double[] nodeX, double[] nodeY) {
        this.nodeCount = nodeCount;
        this.edgeCount = edgeCount;
        this.firstArc = firstArc;
        this.arcTarget = arcTarget;
        this.arcWeight = arcWeight;
        this.nodeX = nodeX;
        this.nodeY = nodeY;
    }

    /**
     * Starts a builder for a graph with a fixed node count.
     * All coordinates default to {@code (0, 0)}.
     *
     * @param nodeCount number of nodes, must be non-negative.
     * @return new builder.
     */
    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount);
    }

    // ========================================================================
    // CORE ACCESSORS (O(1))
    // ========================================================================

    public int arcCount() {
        return arcTarget.length;
    }

    /**
     * First arc index of {@code nodeId}. UNCHECKED - caller must pass a valid node.
     */
    public int firstArc(int nodeId) {
        assert nodeId >= 0 && nodeId < nodeCount : "Node " + nodeId + " out of bounds";
        return firstArc[nodeId];
    }

    /**
     * Exclusive end arc index of {@code nodeId}. UNCHECKED - caller must pass a valid node.
     */
    public int arcEnd(int nodeId) {
        assert nodeId >= 0 && nodeId < nodeCount : "Node " + nodeId + " out of bounds";
        return firstArc[nodeId + 1];
    }

    public int getArcTarget(int arcId) {
        assert arcId >= 0 && arcId < arcTarget.length : "Arc " + arcId + " out of bounds";
        return arcTarget[arcId];
    }

    public double getArcWeight(int arcId) {
        assert arcId >= 0 && arcId < arcWeight.length : "Arc " + arcId + " out of bounds";
        return arcWeight[arcId];
    }

    public int getNodeDegree(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds [0, " + nodeCount + ")");
        }
        return firstArc[nodeId + 1] - firstArc[nodeId];
    }

    public boolean isEmpty() {
        return nodeCount == 0;
    }

    public boolean containsNode(int nodeId) {
        return nodeId >= 0 && nodeId < nodeCount;
    }

    // ========================================================================
    // COORDINATE ACCESS
    // ========================================================================

    public double getNodeX(int nodeId) {
        assert nodeId >= 0 && nodeId < nodeCount;
        return nodeX[nodeId];
    }

    public double getNodeY(int nodeId) {
        assert nodeId >= 0 && nodeId < nodeCount;
        return nodeY[nodeId];
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "WeightedGraph[nodes=%d, edges=%d, avgDegree=%.2f]",
                nodeCount, edgeCount, nodeCount > 0 ? (double) arcCount() / nodeCount : 0);
    }

    /**
     * Multi-line dump of nodes, coordinates and arcs for debugging small graphs.
     */
    public String toDetailedString() {
        if (nodeCount > 50) return toString() + " (too large to detail)";
        StringBuilder sb = new StringBuilder(toString()).append("\n");
        for (int n = 0; n < nodeCount; n++) {
            sb.append(String.format(Locale.ROOT, "Node %d (%.3f, %.3f): [", n, nodeX[n], nodeY[n]));
            for (int a = firstArc[n]; a < firstArc[n + 1]; a++) {
                sb.append(String.format(Locale.ROOT, "%d(%.2f)", arcTarget[a], arcWeight[a]));
                if (a + 1 < firstArc[n + 1]) sb.append(", ");
            }
            sb.append("]\n");
        }
        return sb.toString();
    }

    /**
     * Mutable accumulator for {@link WeightedGraph}. Not thread-safe.
     */
    public static final class Builder {
        private final int nodeCount;
        private final double[] nodeX;
        private final double[] nodeY;
        private final IntArrayList edgeFrom = new IntArrayList();
        private final IntArrayList edgeTo = new IntArrayList();
        private final DoubleArrayList edgeWeight = new DoubleArrayList();

        private Builder(int nodeCount) {
            if (nodeCount < 0) {
                throw new GraphContractException(
                        REASON_NODE_COUNT_NEGATIVE,
                        "nodeCount must be non-negative, got " + nodeCount
                );
            }
            this.nodeCount = nodeCount;
            this.nodeX = new double[nodeCount];
            this.nodeY = new double[nodeCount];
        }

        /**
         * Sets the coordinate of one node.
         */
        public Builder coordinate(int nodeId, double x, double y) {
            requireNode(nodeId);
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                throw new GraphContractException(
                        REASON_COORDINATE_NON_FINITE,
                        "node " + nodeId + " coordinate must be finite, got (" + x + ", " + y + ")"
                );
            }
            nodeX[nodeId] = x;
            nodeY[nodeId] = y;
            return this;
        }

        /**
         * Adds an undirected edge. Both directions are inserted.
         *
         * @throws GraphContractException if an endpoint is out of range or the weight is
         *                                negative or not finite.
         */
        public Builder edge(int u, int v, double weight) {
            requireNode(u);
            requireNode(v);
            if (!Double.isFinite(weight)) {
                throw new GraphContractException(
                        REASON_WEIGHT_NON_FINITE,
                        "edge (" + u + ", " + v + ") weight must be finite, got " + weight
                );
            }
            if (weight < 0.0d) {
                throw new GraphContractException(
                        REASON_WEIGHT_NEGATIVE,
                        "edge (" + u + ", " + v + ") weight must be non-negative, got " + weight
                );
            }
            edgeFrom.add(u);
            edgeTo.add(v);
            edgeWeight.add(weight);
            return this;
        }

        public WeightedGraph build() {
            int edges = edgeFrom.size();
            int arcs = edges * 2;

            int[] firstArc = new int[nodeCount + 1];
            for (int e = 0; e < edges; e++) {
                firstArc[edgeFrom.getInt(e) + 1]++;
                firstArc[edgeTo.getInt(e) + 1]++;
            }
            for (int n = 0; n < nodeCount; n++) {
                firstArc[n + 1] += firstArc[n];
            }

            // Stable placement keeps per-node insertion order.
            int[] cursor = Arrays.copyOf(firstArc, nodeCount);
            int[] arcTarget = new int[arcs];
            double[] arcWeight = new double[arcs];
            for (int e = 0; e < edges; e++) {
                int u = edgeFrom.getInt(e);
                int v = edgeTo.getInt(e);
                double w = edgeWeight.getDouble(e);

                int forward = cursor[u]++;
                arcTarget[forward] = v;
                arcWeight[forward] = w;

                int backward = cursor[v]++;
                arcTarget[backward] = u;
                arcWeight[backward] = w;
            }

            return new WeightedGraph(
                    nodeCount,
                    edges,
                    firstArc,
                    arcTarget,
                    arcWeight,
                    nodeX.clone(),
                    nodeY.clone()
            );
        }

        private void requireNode(int nodeId) {
            if (nodeId < 0 || nodeId >= nodeCount) {
                throw new GraphContractException(
                        REASON_NODE_OUT_OF_RANGE,
                        "node " + nodeId + " out of bounds [0, " + nodeCount + ")"
                );
            }
        }
    }
}
