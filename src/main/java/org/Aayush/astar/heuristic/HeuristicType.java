package org.Aayush.astar.heuristic;

import java.util.Locale;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (pure Dijkstra behavior).</p>
 * <p>{@code EUCLIDEAN} is straight-line distance between node coordinates; admissible and
 * consistent whenever every edge weighs at least the distance between its endpoints.</p>
 * <p>{@code MANHATTAN} is L1 coordinate distance. It dominates Euclidean distance and is
 * therefore only admissible on graphs whose weights dominate L1 distance (grid-like graphs).</p>
 */
public enum HeuristicType {
    NONE("Zero"),
    EUCLIDEAN("Euclidean distance"),
    MANHATTAN("Manhattan distance");

    private final String displayName;

    HeuristicType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return name used in benchmark reports.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Parses a configuration value, case-insensitive.
     *
     * @param raw configured value.
     * @return matching type.
     * @throws HeuristicConfigurationException if the value is blank or unknown.
     */
    public static HeuristicType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new HeuristicConfigurationException(
                    HeuristicFactory.REASON_TYPE_REQUIRED,
                    "heuristic type must be one of NONE, EUCLIDEAN, MANHATTAN"
            );
        }
        try {
            return HeuristicType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new HeuristicConfigurationException(
                    HeuristicFactory.REASON_TYPE_UNKNOWN,
                    "unknown heuristic type '" + raw + "' (NONE, EUCLIDEAN, MANHATTAN)",
                    raw,
                    ex
            );
        }
    }
}
