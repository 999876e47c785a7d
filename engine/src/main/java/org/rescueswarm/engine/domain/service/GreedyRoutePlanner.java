package org.rescueswarm.engine.domain.service;

import org.rescueswarm.engine.domain.geo.GeoCost;
import org.rescueswarm.engine.domain.model.GeoPoint;
import org.rescueswarm.engine.domain.model.PlanningConstraints;
import org.rescueswarm.engine.domain.model.PlanningResult;
import org.rescueswarm.engine.domain.model.Responder;
import org.rescueswarm.engine.domain.model.RouteSolution;
import org.rescueswarm.engine.domain.model.ScoredVictim;
import org.rescueswarm.engine.domain.model.UnassignableVictim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Capacitated, time-bounded multi-responder planner.
 *
 * Construction: responders in id order; each repeatedly takes the most urgent
 * unassigned victim whose cheapest insertion into the open path keeps the route
 * inside the duration budget and the victim cap. Improvement: a 2-opt pass per
 * route with the start fixed at the responder's location.
 *
 * Polynomial heuristic, not an exact VRP solver.
 */
public final class GreedyRoutePlanner implements RoutePlanner {

    private static final Logger LOG = Logger.getLogger(GreedyRoutePlanner.class.getName());

    // Minimum gain for a 2-opt move; keeps rounding noise from flipping routes.
    private static final double IMPROVEMENT_EPSILON_METERS = 1e-6;

    private final GeoCost geoCost;

    public GreedyRoutePlanner(GeoCost geoCost) {
        this.geoCost = Objects.requireNonNull(geoCost, "geoCost must not be null");
    }

    @Override
    public PlanningResult plan(List<ScoredVictim> victims, List<Responder> responders,
                               PlanningConstraints constraints, PlanningDeadline deadline) {
        Objects.requireNonNull(constraints, "constraints must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");
        if (victims == null || victims.isEmpty()) {
            return PlanningResult.empty();
        }

        List<ScoredVictim> ranked = new ArrayList<>(victims);
        Collections.sort(ranked);

        List<Responder> fleet = new ArrayList<>();
        if (responders != null) {
            for (Responder responder : responders) {
                if (responder.isAvailable()) {
                    fleet.add(responder);
                }
            }
        }
        fleet.sort(Comparator.comparing(Responder::getId));

        Set<String> assigned = new HashSet<>();
        List<RouteSolution> solutions = new ArrayList<>();
        boolean timedOut = false;

        for (Responder responder : fleet) {
            if (deadline.isExpired()) {
                timedOut = true;
                break;
            }
            List<ScoredVictim> route = new ArrayList<>();
            timedOut = buildRoute(responder, ranked, assigned, constraints, deadline, route);
            if (!timedOut) {
                timedOut = improveRoute(responder.getLocation(), route, deadline);
            }
            if (!route.isEmpty()) {
                solutions.add(toSolution(responder, route));
            }
            if (timedOut) {
                break;
            }
        }

        List<UnassignableVictim> unassignable = classifyLeftovers(ranked, assigned, fleet, constraints, timedOut);
        PlanningResult result = new PlanningResult(solutions, unassignable, timedOut);
        LOG.fine(() -> "Planning pass: " + result);
        return result;
    }

    /**
     * Greedy construction for one responder.
     *
     * @return true if the deadline fired; {@code route} then holds the partial route
     */
    private boolean buildRoute(Responder responder, List<ScoredVictim> ranked, Set<String> assigned,
                               PlanningConstraints constraints, PlanningDeadline deadline,
                               List<ScoredVictim> route) {
        int cap = constraints.capFor(responder);
        double budgetSeconds = constraints.getMaxRouteDurationSeconds();
        double routeMeters = 0.0;

        while (route.size() < cap) {
            if (deadline.isExpired()) {
                return true;
            }
            ScoredVictim chosen = null;
            Insertion chosenInsertion = null;
            for (ScoredVictim candidate : ranked) {
                if (assigned.contains(candidate.getId())) {
                    continue;
                }
                Insertion insertion = cheapestInsertion(responder.getLocation(), route, candidate.getLocation());
                if (geoCost.travelTimeSeconds(routeMeters + insertion.addedMeters) <= budgetSeconds) {
                    chosen = candidate;
                    chosenInsertion = insertion;
                    break;
                }
            }
            if (chosen == null) {
                break;
            }
            route.add(chosenInsertion.position, chosen);
            assigned.add(chosen.getId());
            routeMeters += chosenInsertion.addedMeters;
        }
        return false;
    }

    /**
     * Position in the open path that adds the least distance. Ties keep the earliest position.
     */
    static Insertion cheapestInsertion(GeoPoint start, List<ScoredVictim> route, GeoPoint stop) {
        Insertion best = null;
        for (int position = 0; position <= route.size(); position++) {
            GeoPoint previous = position == 0 ? start : route.get(position - 1).getLocation();
            double added;
            if (position == route.size()) {
                added = GeoCost.distanceMeters(previous, stop);
            } else {
                GeoPoint next = route.get(position).getLocation();
                added = GeoCost.distanceMeters(previous, stop)
                        + GeoCost.distanceMeters(stop, next)
                        - GeoCost.distanceMeters(previous, next);
            }
            if (best == null || added < best.addedMeters) {
                best = new Insertion(position, added);
            }
        }
        return best;
    }

    /**
     * First-improvement 2-opt on an open path with a fixed start.
     * Only ever shortens the route, so budget and cap stay satisfied.
     *
     * @return true if the deadline fired
     */
    private boolean improveRoute(GeoPoint start, List<ScoredVictim> route, PlanningDeadline deadline) {
        int n = route.size();
        if (n < 2) {
            return false;
        }
        boolean improved = true;
        while (improved) {
            improved = false;
            for (int i = 0; i < n - 1 && !improved; i++) {
                if (deadline.isExpired()) {
                    return true;
                }
                GeoPoint before = i == 0 ? start : route.get(i - 1).getLocation();
                for (int j = i + 1; j < n; j++) {
                    GeoPoint first = route.get(i).getLocation();
                    GeoPoint last = route.get(j).getLocation();
                    double delta = GeoCost.distanceMeters(before, last) - GeoCost.distanceMeters(before, first);
                    if (j < n - 1) {
                        GeoPoint after = route.get(j + 1).getLocation();
                        delta += GeoCost.distanceMeters(first, after) - GeoCost.distanceMeters(last, after);
                    }
                    if (delta < -IMPROVEMENT_EPSILON_METERS) {
                        Collections.reverse(route.subList(i, j + 1));
                        improved = true;
                        break;
                    }
                }
            }
        }
        return false;
    }

    private RouteSolution toSolution(Responder responder, List<ScoredVictim> route) {
        List<String> ids = new ArrayList<>(route.size());
        List<GeoPoint> stops = new ArrayList<>(route.size());
        for (ScoredVictim victim : route) {
            ids.add(victim.getId());
            stops.add(victim.getLocation());
        }
        double meters = GeoCost.pathDistanceMeters(responder.getLocation(), stops);
        List<GeoPoint> path = new ArrayList<>(stops.size() + 1);
        path.add(responder.getLocation());
        path.addAll(stops);
        return new RouteSolution(responder.getId(), ids, path, meters, geoCost.travelTimeSeconds(meters));
    }

    private List<UnassignableVictim> classifyLeftovers(List<ScoredVictim> ranked, Set<String> assigned,
                                                       List<Responder> fleet, PlanningConstraints constraints,
                                                       boolean timedOut) {
        List<UnassignableVictim> leftovers = new ArrayList<>();
        for (ScoredVictim victim : ranked) {
            if (assigned.contains(victim.getId())) {
                continue;
            }
            UnassignableVictim.Reason reason;
            if (timedOut) {
                reason = UnassignableVictim.Reason.PLANNING_TIMEOUT;
            } else if (fleet.isEmpty()) {
                reason = UnassignableVictim.Reason.NO_RESPONDERS;
            } else if (!reachableByAny(victim, fleet, constraints)) {
                reason = UnassignableVictim.Reason.OUT_OF_RANGE;
            } else {
                reason = UnassignableVictim.Reason.NO_CAPACITY;
            }
            leftovers.add(new UnassignableVictim(victim.getId(), reason));
        }
        return leftovers;
    }

    private boolean reachableByAny(ScoredVictim victim, List<Responder> fleet, PlanningConstraints constraints) {
        double reach = geoCost.reachMeters(constraints.getMaxRouteDurationSeconds());
        for (Responder responder : fleet) {
            if (constraints.capFor(responder) == 0) {
                continue;
            }
            if (GeoCost.distanceMeters(responder.getLocation(), victim.getLocation()) <= reach) {
                return true;
            }
        }
        return false;
    }

    static final class Insertion {
        final int position;
        final double addedMeters;

        Insertion(int position, double addedMeters) {
            this.position = position;
            this.addedMeters = addedMeters;
        }
    }
}
