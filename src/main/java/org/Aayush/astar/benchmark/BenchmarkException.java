package org.Aayush.astar.benchmark;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a benchmark cannot produce trustworthy measurements, for example when the
 * time source fails or runs backwards.
 */
@Getter
@Accessors(fluent = true)
public final class BenchmarkException extends RuntimeException {
    public static final String REASON_CLOCK_FAILURE = "B_CLOCK_FAILURE";
    public static final String REASON_CLOCK_NOT_MONOTONIC = "B_CLOCK_NOT_MONOTONIC";

    private final String reasonCode;

    public BenchmarkException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public BenchmarkException(String reasonCode, String message, Throwable cause) {
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
