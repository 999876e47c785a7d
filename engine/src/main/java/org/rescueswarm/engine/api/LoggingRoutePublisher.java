package org.rescueswarm.engine.api;

import org.rescueswarm.engine.domain.model.RouteSolution;

import java.util.List;
import java.util.logging.Logger;

/**
 * Publisher used when no downstream URL is configured: routes go to the log.
 */
public final class LoggingRoutePublisher implements RoutePublisher {

    private static final Logger LOG = Logger.getLogger(LoggingRoutePublisher.class.getName());

    @Override
    public boolean publish(List<RouteSolution> solutions) {
        LOG.info(() -> "Route set (" + solutions.size() + " routes)");
        for (RouteSolution solution : solutions) {
            LOG.info(() -> "  " + solution);
        }
        return true;
    }
}
