package org.rescueswarm.engine.domain.model;

import java.time.Instant;

/**
 * A single observation asserting a victim exists at a location.
 * Fields are not validated here; the victim registry rejects malformed detections.
 */
public final class Detection {

    private final String victimCandidateId;
    private final GeoPoint location;
    private final InjuryLevel injuryLevel;
    private final double survivalLikelihood;
    private final Instant detectedAt;

    public Detection(String victimCandidateId, GeoPoint location, InjuryLevel injuryLevel,
                     double survivalLikelihood, Instant detectedAt) {
        this.victimCandidateId = victimCandidateId;
        this.location = location;
        this.injuryLevel = injuryLevel;
        this.survivalLikelihood = survivalLikelihood;
        this.detectedAt = detectedAt;
    }

    /**
     * Detection without an upstream candidate id.
     */
    public static Detection at(GeoPoint location, InjuryLevel injuryLevel,
                               double survivalLikelihood, Instant detectedAt) {
        return new Detection(null, location, injuryLevel, survivalLikelihood, detectedAt);
    }

    public String getVictimCandidateId() {
        return victimCandidateId;
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

    @Override
    public String toString() {
        return "Detection{candidate='" + victimCandidateId + "', location=" + location
                + ", injury=" + injuryLevel + ", survival=" + survivalLikelihood
                + ", detectedAt=" + detectedAt + '}';
    }
}
