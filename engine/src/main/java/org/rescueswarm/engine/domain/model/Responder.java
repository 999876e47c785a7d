package org.rescueswarm.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a responder and its current route.
 */
public final class Responder {

    private final String id;
    private final GeoPoint location;
    private final int capacity;
    private final ResponderStatus status;
    private final List<String> currentRoute;

    public Responder(String id, GeoPoint location, int capacity, ResponderStatus status, List<String> currentRoute) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.capacity = capacity;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.currentRoute = currentRoute == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(currentRoute));
    }

    public String getId() {
        return id;
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

    public List<String> getCurrentRoute() {
        return currentRoute;
    }

    public boolean isAvailable() {
        return status == ResponderStatus.AVAILABLE;
    }

    @Override
    public String toString() {
        return String.format("Responder{id='%s', status=%s, capacity=%d, route=%s}",
                id, status, capacity, currentRoute);
    }
}
