package org.rescueswarm.engine.domain;

/**
 * A route assignment longer than the responder's capacity.
 */
public final class CapacityExceededException extends DispatchException {

    public static final String REASON = "CAPACITY_EXCEEDED";

    private final String responderId;
    private final int capacity;
    private final int requested;

    public CapacityExceededException(String responderId, int capacity, int requested) {
        super(REASON, String.format("responder %s has capacity %d, route needs %d", responderId, capacity, requested));
        this.responderId = responderId;
        this.capacity = capacity;
        this.requested = requested;
    }

    public String getResponderId() {
        return responderId;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getRequested() {
        return requested;
    }
}
