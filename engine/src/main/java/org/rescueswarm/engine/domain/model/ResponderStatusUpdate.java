package org.rescueswarm.engine.domain.model;

/**
 * Status report sent by a responder team.
 */
public final class ResponderStatusUpdate {

    private final String responderId;
    private final GeoPoint location;
    private final int capacity;
    private final ResponderStatus status;

    public ResponderStatusUpdate(String responderId, GeoPoint location, int capacity, ResponderStatus status) {
        this.responderId = responderId;
        this.location = location;
        this.capacity = capacity;
        this.status = status;
    }

    public String getResponderId() {
        return responderId;
    }

    public GeoPoint getLocation() {
        return location;
    }

    public int getCapacity() {
        return capacity;
    }

    public ResponderStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "ResponderStatusUpdate{id='" + responderId + "', location=" + location
                + ", capacity=" + capacity + ", status=" + status + '}';
    }
}
