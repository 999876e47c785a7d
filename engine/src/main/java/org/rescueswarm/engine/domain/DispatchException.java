package org.rescueswarm.engine.domain;

import java.util.Objects;

/**
 * Base class for dispatch contract failures, carrying a stable reason code.
 */
public class DispatchException extends RuntimeException {

    private final String reasonCode;

    public DispatchException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    private static String formatMessage(String reasonCode, String message) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode must not be null");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + code + "] " + Objects.requireNonNull(message, "message must not be null");
    }
}
