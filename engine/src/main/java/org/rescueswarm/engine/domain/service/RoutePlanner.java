package org.rescueswarm.engine.domain.service;

import org.rescueswarm.engine.domain.model.PlanningConstraints;
import org.rescueswarm.engine.domain.model.PlanningResult;
import org.rescueswarm.engine.domain.model.Responder;
import org.rescueswarm.engine.domain.model.ScoredVictim;

import java.util.List;

/**
 * Assigns ordered victim sequences to responders.
 */
public interface RoutePlanner {

    /**
     * Plan routes for one pass.
     *
     * <p>Each responder starts from its own location with no return leg. Routes never
     * exceed the responder's capacity, the per-responder victim cap or the duration
     * budget, and no victim appears on more than one route. The result is deterministic
     * for the same inputs. When the deadline fires, the routes built so far are returned
     * with {@link PlanningResult#isTimedOut()} set.
     *
     * @param victims scored active victims
     * @param responders candidate responders; only available ones are used
     * @param constraints duration budget and victim cap
     * @param deadline wall-clock ceiling for this pass
     */
    PlanningResult plan(List<ScoredVictim> victims, List<Responder> responders,
                        PlanningConstraints constraints, PlanningDeadline deadline);
}
