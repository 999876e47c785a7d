package org.rescueswarm.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of one planning pass.
 */
public final class PlanningResult {

    private static final PlanningResult EMPTY =
            new PlanningResult(Collections.emptyList(), Collections.emptyList(), false);

    private final List<RouteSolution> solutions;
    private final List<UnassignableVictim> unassignable;
    private final boolean timedOut;

    public PlanningResult(List<RouteSolution> solutions, List<UnassignableVictim> unassignable, boolean timedOut) {
        this.solutions = Collections.unmodifiableList(new ArrayList<>(solutions));
        this.unassignable = Collections.unmodifiableList(new ArrayList<>(unassignable));
        this.timedOut = timedOut;
    }

    public static PlanningResult empty() {
        return EMPTY;
    }

    public List<RouteSolution> getSolutions() {
        return solutions;
    }

    public List<UnassignableVictim> getUnassignable() {
        return unassignable;
    }

    /**
     * True when the planner hit its deadline; the solutions are the best found until then.
     */
    public boolean isTimedOut() {
        return timedOut;
    }

    public int assignedCount() {
        int count = 0;
        for (RouteSolution solution : solutions) {
            count += solution.getOrderedVictimIds().size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "PlanningResult{solutions=" + solutions.size()
                + ", assigned=" + assignedCount()
                + ", unassignable=" + unassignable.size()
                + ", timedOut=" + timedOut + '}';
    }
}
