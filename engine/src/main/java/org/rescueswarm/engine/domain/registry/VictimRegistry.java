package org.rescueswarm.engine.domain.registry;

import org.rescueswarm.engine.domain.model.Detection;
import org.rescueswarm.engine.domain.model.DetectionResult;
import org.rescueswarm.engine.domain.model.Victim;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Owns victim records: deduplicates detections, tracks lifecycle and ages records out.
 * Every operation is atomic with respect to concurrent callers. Operations on unknown
 * ids are no-ops, since the upstream feed may resend stale data.
 */
public interface VictimRegistry {

    /**
     * Merge a detection into the active victim it refers to, or register a new victim.
     *
     * @return the resolved victim id and whether a record was created
     * @throws org.rescueswarm.engine.domain.ValidationException on malformed coordinates or attributes
     */
    DetectionResult upsertDetection(Detection detection);

    /**
     * Transition an active victim to served.
     *
     * @return true if the status changed
     */
    boolean markServed(String victimId);

    /**
     * Expire active, unassigned victims detected more than {@code maxAge} before {@code now}.
     *
     * @return ids of the victims that were expired
     */
    List<String> expireStale(Instant now, Duration maxAge);

    /**
     * Active victims in insertion order.
     */
    List<Victim> activeVictims();

    /**
     * All retained victims, any status, in insertion order.
     */
    List<Victim> allVictims();

    /**
     * Get a victim snapshot, or null when unknown.
     */
    Victim get(String victimId);

    /**
     * Record that the given active victims are on a responder's route.
     */
    void assign(Collection<String> victimIds, String responderId);

    /**
     * Clear the assignment of the given victims, returning active ones to the planning pool.
     */
    void release(Collection<String> victimIds);

    /**
     * Store the latest priority scores. Ids not in the map keep their previous score.
     */
    void updateScores(Map<String, Double> scores);

    /**
     * Drop served and expired records retired more than {@code retention} before {@code now}.
     *
     * @return number of records removed
     */
    int purgeRetired(Instant now, Duration retention);

    /**
     * Number of retained records, any status.
     */
    int size();
}
