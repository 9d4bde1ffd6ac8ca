package org.Aayush.astar.search;

import lombok.Getter;

import java.util.Objects;

/**
 * Search input contract exception with deterministic reason codes.
 *
 * <p>Raised before any work is done when the graph, endpoints or heuristic cannot
 * support a well-defined search.</p>
 */
@Getter
public final class SearchContractException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded search contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public SearchContractException(String reasonCode, String message) {
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
