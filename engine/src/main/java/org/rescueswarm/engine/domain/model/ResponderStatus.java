package org.rescueswarm.engine.domain.model;

import java.util.Locale;

/**
 * Responder availability as reported by the field.
 */
public enum ResponderStatus {
    AVAILABLE("available"),
    ENROUTE("enroute"),
    UNAVAILABLE("unavailable");

    private final String code;

    ResponderStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a wire code. "en_route" is accepted as an alias of "enroute".
     *
     * @return the matching status, or null when the code is unknown
     */
    public static ResponderStatus fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace("_", "");
        for (ResponderStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
