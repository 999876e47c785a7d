package org.rescueswarm.engine.domain.model;

import java.util.Objects;

/**
 * A victim snapshot paired with the priority score of one scoring pass.
 * Natural order is dispatch order: highest score first, then oldest detection, then id.
 */
public final class ScoredVictim implements Comparable<ScoredVictim> {

    private final Victim victim;
    private final double score;

    public ScoredVictim(Victim victim, double score) {
        this.victim = Objects.requireNonNull(victim, "victim must not be null");
        this.score = score;
    }

    public Victim getVictim() {
        return victim;
    }

    public String getId() {
        return victim.getId();
    }

    public GeoPoint getLocation() {
        return victim.getLocation();
    }

    public double getScore() {
        return score;
    }

    @Override
    public int compareTo(ScoredVictim other) {
        int byScore = Double.compare(other.score, this.score);
        if (byScore != 0) {
            return byScore;
        }
        int byAge = victim.getDetectedAt().compareTo(other.victim.getDetectedAt());
        if (byAge != 0) {
            return byAge;
        }
        return victim.getId().compareTo(other.victim.getId());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoredVictim)) {
            return false;
        }
        ScoredVictim other = (ScoredVictim) o;
        return Double.compare(score, other.score) == 0 && victim.getId().equals(other.victim.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(victim.getId(), score);
    }

    @Override
    public String toString() {
        return String.format("ScoredVictim{id='%s', score=%.2f}", victim.getId(), score);
    }
}
