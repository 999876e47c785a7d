package org.rescueswarm.engine.domain.model;

import java.util.Locale;

/**
 * Ordinal injury severity reported with a detection.
 */
public enum InjuryLevel {
    NONE("none"),
    MINOR("minor"),
    SEVERE("severe"),
    UNCONSCIOUS("unconscious");

    private final String code;

    InjuryLevel(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a wire code such as "severe".
     *
     * @return the matching level, or null when the code is unknown
     */
    public static InjuryLevel fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (InjuryLevel level : values()) {
            if (level.code.equals(normalized)) {
                return level;
            }
        }
        return null;
    }
}
