package org.rescueswarm.engine.api;

import org.rescueswarm.engine.domain.model.RouteSolution;

import java.util.List;

/**
 * Pushes route solutions to downstream collaborators (API layer, dashboard).
 * Implementations must not throw; delivery failures are logged and dropped.
 */
public interface RoutePublisher {

    /**
     * Publish the current route set.
     *
     * @param solutions routes in responder-id order
     * @return true if the collaborator accepted the routes
     */
    boolean publish(List<RouteSolution> solutions);
}
