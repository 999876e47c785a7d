package org.rescueswarm.engine.domain.model;

import java.util.Objects;

/**
 * A victim left without a responder after a planning pass. Non-fatal: the victim
 * stays active and is reconsidered on the next pass.
 */
public final class UnassignableVictim {

    /**
     * Why the victim could not be placed on any route.
     */
    public enum Reason {
        /** No responder was available at all. */
        NO_RESPONDERS,
        /** Even alone, the victim is beyond every available responder's time budget. */
        OUT_OF_RANGE,
        /** Reachable, but every route was already full or out of budget. */
        NO_CAPACITY,
        /** Planning stopped at its deadline before the victim was considered. */
        PLANNING_TIMEOUT
    }

    private final String victimId;
    private final Reason reason;

    public UnassignableVictim(String victimId, Reason reason) {
        this.victimId = Objects.requireNonNull(victimId, "victimId must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public String getVictimId() {
        return victimId;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnassignableVictim)) {
            return false;
        }
        UnassignableVictim other = (UnassignableVictim) o;
        return victimId.equals(other.victimId) && reason == other.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(victimId, reason);
    }

    @Override
    public String toString() {
        return victimId + ":" + reason;
    }
}
