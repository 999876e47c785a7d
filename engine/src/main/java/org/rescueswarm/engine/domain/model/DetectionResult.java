package org.rescueswarm.engine.domain.model;

import java.util.Objects;

/**
 * Outcome of ingesting a detection: the victim it resolved to and whether it was new.
 */
public final class DetectionResult {

    private final String victimId;
    private final boolean created;

    public DetectionResult(String victimId, boolean created) {
        this.victimId = Objects.requireNonNull(victimId, "victimId must not be null");
        this.created = created;
    }

    public String getVictimId() {
        return victimId;
    }

    public boolean isCreated() {
        return created;
    }

    @Override
    public String toString() {
        return "DetectionResult{victimId='" + victimId + "', created=" + created + '}';
    }
}
