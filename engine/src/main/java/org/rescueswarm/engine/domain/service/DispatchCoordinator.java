package org.rescueswarm.engine.domain.service;

import org.rescueswarm.engine.domain.model.Detection;
import org.rescueswarm.engine.domain.model.DetectionResult;
import org.rescueswarm.engine.domain.model.ResponderStatusUpdate;
import org.rescueswarm.engine.domain.model.RouteSolution;
import org.rescueswarm.engine.domain.model.SystemStatus;
import org.rescueswarm.engine.domain.model.UnassignableVictim;
import org.rescueswarm.engine.domain.model.Victim;

import java.time.Instant;
import java.util.List;

/**
 * Orchestrates ingestion, scoring, planning and route application.
 * The only component that writes across the victim and responder registries.
 */
public interface DispatchCoordinator {

    /**
     * Ingest a detection and mark scores for recomputation.
     *
     * @throws org.rescueswarm.engine.domain.ValidationException on malformed detections
     */
    DetectionResult onDetection(Detection detection);

    /**
     * Ingest a responder status report. A responder that leaves ENROUTE without a
     * completion signal gives its victims back to the planning pool.
     */
    void onResponderStatus(ResponderStatusUpdate update);

    /**
     * Run one scoring and routing pass over a consistent snapshot and apply the result.
     * Calling it again without any state change returns the same route set.
     *
     * @return the full current route set, ordered by responder id
     */
    List<RouteSolution> replan(Instant now);

    /**
     * Mark every victim on the responder's route as served and free the responder.
     *
     * @return ids of the victims that were served; empty for unknown or idle responders
     */
    List<String> onRouteCompletion(String responderId);

    /**
     * Expire unassigned victims older than the configured maximum age.
     */
    List<String> expireStale(Instant now);

    /**
     * Drop served and expired records past the retention window.
     */
    int purgeRetired(Instant now);

    /**
     * Current route set, ordered by responder id.
     */
    List<RouteSolution> getRoutes();

    /**
     * Retained victims ordered by priority score, highest first.
     */
    List<Victim> getVictims();

    SystemStatus getSystemStatus();

    /**
     * Victims the most recent pass could not place.
     */
    List<UnassignableVictim> getUnassignable();
}
