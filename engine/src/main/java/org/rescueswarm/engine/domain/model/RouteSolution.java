package org.rescueswarm.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered victim assignment for one responder, produced by one planning pass.
 */
public final class RouteSolution {

    private final String responderId;
    private final List<String> orderedVictimIds;
    private final List<GeoPoint> path;
    private final double totalDistanceMeters;
    private final double estimatedDurationSeconds;

    public RouteSolution(String responderId, List<String> orderedVictimIds,
                         double totalDistanceMeters, double estimatedDurationSeconds) {
        this(responderId, orderedVictimIds, Collections.emptyList(), totalDistanceMeters, estimatedDurationSeconds);
    }

    /**
     * @param path responder start followed by each stop, in visiting order; may be empty when unknown
     */
    public RouteSolution(String responderId, List<String> orderedVictimIds, List<GeoPoint> path,
                         double totalDistanceMeters, double estimatedDurationSeconds) {
        this.responderId = Objects.requireNonNull(responderId, "responderId must not be null");
        this.orderedVictimIds = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(orderedVictimIds, "orderedVictimIds must not be null")));
        this.path = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(path, "path must not be null")));
        this.totalDistanceMeters = totalDistanceMeters;
        this.estimatedDurationSeconds = estimatedDurationSeconds;
    }

    public String getResponderId() {
        return responderId;
    }

    public List<String> getOrderedVictimIds() {
        return orderedVictimIds;
    }

    public List<GeoPoint> getPath() {
        return path;
    }

    public double getTotalDistanceMeters() {
        return totalDistanceMeters;
    }

    public double getEstimatedDurationSeconds() {
        return estimatedDurationSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RouteSolution)) {
            return false;
        }
        RouteSolution other = (RouteSolution) o;
        return Double.compare(totalDistanceMeters, other.totalDistanceMeters) == 0
                && Double.compare(estimatedDurationSeconds, other.estimatedDurationSeconds) == 0
                && responderId.equals(other.responderId)
                && orderedVictimIds.equals(other.orderedVictimIds)
                && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(responderId, orderedVictimIds, path, totalDistanceMeters, estimatedDurationSeconds);
    }

    @Override
    public String toString() {
        return String.format("RouteSolution{responder='%s', victims=%s, distance=%.0fm, duration=%.0fs}",
                responderId, orderedVictimIds, totalDistanceMeters, estimatedDurationSeconds);
    }
}
