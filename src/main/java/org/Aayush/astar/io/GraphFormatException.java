package org.Aayush.astar.io;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a graph file or folder cannot be read into a graph instance.
 */
@Getter
@Accessors(fluent = true)
public final class GraphFormatException extends RuntimeException {
    public static final String REASON_IO = "F_IO";
    public static final String REASON_DIRECTORY_MISSING = "F_DIRECTORY_MISSING";
    public static final String REASON_TRUNCATED = "F_TRUNCATED";
    public static final String REASON_BAD_NUMBER = "F_BAD_NUMBER";
    public static final String REASON_NODE_COUNT_NEGATIVE = "F_NODE_COUNT_NEGATIVE";
    public static final String REASON_EDGE_COUNT_NEGATIVE = "F_EDGE_COUNT_NEGATIVE";
    public static final String REASON_GRAPH_CONTRACT = "F_GRAPH_CONTRACT";

    private final String reasonCode;

    public GraphFormatException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public GraphFormatException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
