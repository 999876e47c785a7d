package org.rescueswarm.engine.domain.model;

/**
 * Victim lifecycle. SERVED and EXPIRED are terminal.
 */
public enum VictimStatus {
    ACTIVE("active"),
    SERVED("served"),
    EXPIRED("expired");

    private final String code;

    VictimStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
