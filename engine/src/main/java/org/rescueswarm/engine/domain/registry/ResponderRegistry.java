package org.rescueswarm.engine.domain.registry;

import org.rescueswarm.engine.domain.model.Responder;
import org.rescueswarm.engine.domain.model.ResponderStatusUpdate;

import java.util.List;

/**
 * Owns responder records: location, capacity, availability and current route.
 * Every operation is atomic with respect to concurrent callers.
 */
public interface ResponderRegistry {

    /**
     * Insert or replace a responder's status, location and capacity.
     * A report of AVAILABLE or UNAVAILABLE clears the current route; ENROUTE keeps it.
     *
     * @return the snapshot before the update, or null for a new responder
     * @throws org.rescueswarm.engine.domain.ValidationException on malformed fields
     * @throws org.rescueswarm.engine.domain.CapacityExceededException if the kept route no longer fits
     */
    Responder upsert(ResponderStatusUpdate update);

    /**
     * Mark a responder available and clear its route. Unknown ids are ignored.
     *
     * @return the route that was cleared, empty if none
     */
    List<String> setAvailable(String responderId);

    /**
     * Replace a responder's route. A non-empty route puts the responder ENROUTE,
     * an empty one makes it AVAILABLE.
     *
     * @return false if the responder is unknown
     * @throws org.rescueswarm.engine.domain.CapacityExceededException if the route is longer than the capacity
     */
    boolean setRoute(String responderId, List<String> victimIds);

    /**
     * Available responders ordered by id.
     */
    List<Responder> availableResponders();

    /**
     * All responders ordered by id.
     */
    List<Responder> all();

    /**
     * Get a responder snapshot, or null when unknown.
     */
    Responder get(String responderId);
}
