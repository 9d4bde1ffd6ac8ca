package org.Aayush.astar.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when graph construction receives topology, weight or coordinate data
 * that violates the graph contract.
 *
 * <p>Messages are prefixed with deterministic reason-code text.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GraphContractException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded graph contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public GraphContractException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
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
