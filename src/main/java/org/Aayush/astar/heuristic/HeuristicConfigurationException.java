package org.Aayush.astar.heuristic;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Raised when no heuristic provider can be built for the requested type and graph.
 *
 * <p>The message reads {@code [reasonCode] detail}. When the failure came from parsing a
 * configured value, {@link #rejectedValue()} holds that raw value; otherwise it is null.</p>
 */
@Getter
@Accessors(fluent = true)
public final class HeuristicConfigurationException extends RuntimeException {
    private final String reasonCode;
    private final String rejectedValue;

    public HeuristicConfigurationException(String reasonCode, String detail) {
        this(reasonCode, detail, null, null);
    }

    /**
     * @param rejectedValue configured value that could not be used, may be null.
     * @param cause parse failure behind the rejection, may be null.
     */
    public HeuristicConfigurationException(String reasonCode, String detail, String rejectedValue, Throwable cause) {
        super("[" + checkedCode(reasonCode) + "] " + Objects.requireNonNull(detail, "detail"), cause);
        this.reasonCode = reasonCode;
        this.rejectedValue = rejectedValue;
    }

    private static String checkedCode(String reasonCode) {
        if (Objects.requireNonNull(reasonCode, "reasonCode").isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
