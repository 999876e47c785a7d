package org.rescueswarm.engine.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a victim record.
 * The registry owns the live record and hands out snapshots only.
 */
public final class Victim {

    private final String id;
    private final GeoPoint location;
    private final InjuryLevel injuryLevel;
    private final double survivalLikelihood;
    private final Instant detectedAt;
    private final Instant lastSeenAt;
    private final double priorityScore;
    private final VictimStatus status;
    private final String assignedResponderId;
    private final Instant retiredAt;

    private Victim(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.location = Objects.requireNonNull(builder.location, "location must not be null");
        this.injuryLevel = Objects.requireNonNull(builder.injuryLevel, "injuryLevel must not be null");
        this.survivalLikelihood = builder.survivalLikelihood;
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        this.lastSeenAt = builder.lastSeenAt != null ? builder.lastSeenAt : builder.detectedAt;
        this.priorityScore = builder.priorityScore;
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.assignedResponderId = builder.assignedResponderId;
        this.retiredAt = builder.retiredAt;
    }

    public String getId() {
        return id;
    }

    public GeoPoint getLocation() {
        return location;
    }

    public InjuryLevel getInjuryLevel() {
        return injuryLevel;
    }

    public double getSurvivalLikelihood() {
        return survivalLikelihood;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public double getPriorityScore() {
        return priorityScore;
    }

    public VictimStatus getStatus() {
        return status;
    }

    public String getAssignedResponderId() {
        return assignedResponderId;
    }

    public Instant getRetiredAt() {
        return retiredAt;
    }

    public boolean isActive() {
        return status == VictimStatus.ACTIVE;
    }

    public boolean isAssigned() {
        return assignedResponderId != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .location(location)
                .injuryLevel(injuryLevel)
                .survivalLikelihood(survivalLikelihood)
                .detectedAt(detectedAt)
                .lastSeenAt(lastSeenAt)
                .priorityScore(priorityScore)
                .status(status)
                .assignedResponderId(assignedResponderId)
                .retiredAt(retiredAt);
    }

    @Override
    public String toString() {
        return String.format("Victim{id='%s', injury=%s, survival=%.2f, score=%.2f, status=%s}",
                id, injuryLevel, survivalLikelihood, priorityScore, status);
    }

    /**
     * Builder for Victim.
     */
    public static final class Builder {
        private String id;
        private GeoPoint location;
        private InjuryLevel injuryLevel;
        private double survivalLikelihood;
        private Instant detectedAt;
        private Instant lastSeenAt;
        private double priorityScore;
        private VictimStatus status = VictimStatus.ACTIVE;
        private String assignedResponderId;
        private Instant retiredAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder injuryLevel(InjuryLevel injuryLevel) {
            this.injuryLevel = injuryLevel;
            return this;
        }

        public Builder survivalLikelihood(double survivalLikelihood) {
            this.survivalLikelihood = survivalLikelihood;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder lastSeenAt(Instant lastSeenAt) {
            this.lastSeenAt = lastSeenAt;
            return this;
        }

        public Builder priorityScore(double priorityScore) {
            this.priorityScore = priorityScore;
            return this;
        }

        public Builder status(VictimStatus status) {
            this.status = status;
            return this;
        }

        public Builder assignedResponderId(String assignedResponderId) {
            this.assignedResponderId = assignedResponderId;
            return this;
        }

        public Builder retiredAt(Instant retiredAt) {
            this.retiredAt = retiredAt;
            return this;
        }

        public Victim build() {
            return new Victim(this);
        }
    }
}
