package org.Aayush.graphlab;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base of the reason-coded failures raised by graph persistence and rendering.
 *
 * <p>Messages read {@code [REASON_CODE] detail}; callers branch on {@link #reasonCode()}
 * rather than on message text.</p>
 */
@Getter
@Accessors(fluent = true)
public abstract class GraphLabException extends RuntimeException {
    private final String reasonCode;

    protected GraphLabException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    protected GraphLabException(String reasonCode, String message, Throwable cause) {
        super("[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"), cause);
        this.reasonCode = reasonCode;
    }

    private static String requireReasonCode(String reasonCode) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
