package org.Aayush.astar.heuristic;

import lombok.experimental.UtilityClass;

/**
 * Numeric helpers for planar geometry distances.
 */
@UtilityClass
final class GeometryDistance {

    /**
     * Straight-line (L2) distance.
     */
    static double euclideanDistance(double x1, double y1, double x2, double y2) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Axis-aligned (L1) distance.
     */
    static double manhattanDistance(double x1, double y1, double x2, double y2) {
        return Math.abs(x2 - x1) + Math.abs(y2 - y1);
    }

    /**
     * Collapses non-finite or negative geometry results to zero so estimates stay usable.
     */
    static double sanitize(double estimate) {
        if (!Double.isFinite(estimate) || estimate < 0.0d) {
            return 0.0d;
        }
        return estimate;
    }
}
