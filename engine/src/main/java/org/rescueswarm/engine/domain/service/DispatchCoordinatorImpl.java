package org.rescueswarm.engine.domain.service;

import org.rescueswarm.engine.api.RoutePublisher;
import org.rescueswarm.engine.domain.model.Detection;
import org.rescueswarm.engine.domain.model.DetectionResult;
import org.rescueswarm.engine.domain.model.DispatchConfig;
import org.rescueswarm.engine.domain.model.PlanningConstraints;
import org.rescueswarm.engine.domain.model.PlanningResult;
import org.rescueswarm.engine.domain.model.Responder;
import org.rescueswarm.engine.domain.model.ResponderStatus;
import org.rescueswarm.engine.domain.model.ResponderStatusUpdate;
import org.rescueswarm.engine.domain.model.RouteSolution;
import org.rescueswarm.engine.domain.model.ScoredVictim;
import org.rescueswarm.engine.domain.model.SystemStatus;
import org.rescueswarm.engine.domain.model.UnassignableVictim;
import org.rescueswarm.engine.domain.model.Victim;
import org.rescueswarm.engine.domain.registry.ResponderRegistry;
import org.rescueswarm.engine.domain.registry.VictimRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Implementation of DispatchCoordinator.
 *
 * Locking: the state lock's read side is shared by single-registry ingestion, so
 * concurrent producers never wait on each other; its write side is held only while
 * snapshotting, applying a plan, or writing across registries. Planning itself runs
 * outside the state lock. A separate lock serialises replan calls.
 */
public final class DispatchCoordinatorImpl implements DispatchCoordinator {

    private static final Logger LOG = Logger.getLogger(DispatchCoordinatorImpl.class.getName());

    private static final Comparator<Victim> BY_PRIORITY = Comparator
            .comparingDouble(Victim::getPriorityScore).reversed()
            .thenComparing(Victim::getDetectedAt)
            .thenComparing(Victim::getId);

    private final VictimRegistry victims;
    private final ResponderRegistry responders;
    private final PriorityScorer scorer;
    private final RoutePlanner planner;
    private final RoutePublisher publisher;
    private final DispatchConfig config;
    private final Clock clock;

    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final ReentrantLock planningLock = new ReentrantLock();
    private final Map<String, RouteSolution> activeRoutes = new TreeMap<>();
    private final AtomicBoolean scoresStale = new AtomicBoolean(false);

    private volatile PlanningResult lastResult = PlanningResult.empty();
    private volatile Runnable newVictimListener;

    public DispatchCoordinatorImpl(VictimRegistry victims, ResponderRegistry responders, PriorityScorer scorer,
                                   RoutePlanner planner, RoutePublisher publisher, DispatchConfig config,
                                   Clock clock) {
        this.victims = Objects.requireNonNull(victims, "victims must not be null");
        this.responders = Objects.requireNonNull(responders, "responders must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Callback run after a detection creates a new victim, e.g. to request an immediate replan.
     */
    public void setNewVictimListener(Runnable listener) {
        this.newVictimListener = listener;
    }

    @Override
    public DetectionResult onDetection(Detection detection) {
        DetectionResult result;
        stateLock.readLock().lock();
        try {
            result = victims.upsertDetection(detection);
        } finally {
            stateLock.readLock().unlock();
        }
        scoresStale.set(true);

        Runnable listener = newVictimListener;
        if (result.isCreated() && listener != null) {
            listener.run();
        }
        return result;
    }

    @Override
    public void onResponderStatus(ResponderStatusUpdate update) {
        boolean routeDropped = false;
        stateLock.writeLock().lock();
        try {
            Responder previous = responders.upsert(update);
            boolean abandoned = previous != null
                    && previous.getStatus() == ResponderStatus.ENROUTE
                    && update.getStatus() != ResponderStatus.ENROUTE
                    && !previous.getCurrentRoute().isEmpty();
            if (abandoned) {
                victims.release(previous.getCurrentRoute());
                routeDropped = activeRoutes.remove(previous.getId()) != null;
                LOG.warning(() -> String.format("Responder %s left its route without completion, released %s",
                        previous.getId(), previous.getCurrentRoute()));
            }
        } finally {
            stateLock.writeLock().unlock();
        }
        if (routeDropped) {
            publish(getRoutes());
        }
    }

    @Override
    public List<RouteSolution> replan(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        planningLock.lock();
        try {
            List<Victim> active;
            List<Responder> available;
            stateLock.writeLock().lock();
            try {
                // cleared before the snapshot so a detection racing it re-marks the scores
                scoresStale.set(false);
                active = victims.activeVictims();
                available = responders.availableResponders();
            } finally {
                stateLock.writeLock().unlock();
            }

            List<ScoredVictim> ranked = rescore(active, now);
            List<ScoredVictim> pool = new ArrayList<>();
            for (ScoredVictim scored : ranked) {
                if (!scored.getVictim().isAssigned()) {
                    pool.add(scored);
                }
            }

            PlanningResult result = planner.plan(pool, available, PlanningConstraints.from(config),
                    PlanningDeadline.afterMillis(config.getPlanningTimeBudgetMillis()));
            logOutcome(result);

            List<RouteSolution> applied = apply(result.getSolutions());
            lastResult = result;

            List<RouteSolution> current = getRoutes();
            if (!applied.isEmpty()) {
                LOG.info(() -> String.format("Replan applied %d new routes (%d active)", applied.size(), current.size()));
                publish(current);
            }
            return current;
        } finally {
            planningLock.unlock();
        }
    }

    @Override
    public List<String> onRouteCompletion(String responderId) {
        List<String> served = new ArrayList<>();
        boolean routeDropped = false;
        stateLock.writeLock().lock();
        try {
            Responder responder = responders.get(responderId);
            if (responder == null) {
                LOG.fine(() -> "Completion for unknown responder " + responderId);
                return Collections.emptyList();
            }
            String id = responder.getId();
            List<String> formerRoute = responders.setAvailable(id);
            for (String victimId : formerRoute) {
                if (victims.markServed(victimId)) {
                    served.add(victimId);
                }
            }
            routeDropped = activeRoutes.remove(id) != null;
            LOG.info(() -> String.format("Responder %s completed route, served %s", id, served));
        } finally {
            stateLock.writeLock().unlock();
        }
        if (routeDropped) {
            publish(getRoutes());
        }
        return served;
    }

    @Override
    public List<String> expireStale(Instant now) {
        stateLock.readLock().lock();
        try {
            return victims.expireStale(now, Duration.ofSeconds(config.getVictimMaxAgeSeconds()));
        } finally {
            stateLock.readLock().unlock();
        }
    }

    @Override
    public int purgeRetired(Instant now) {
        stateLock.readLock().lock();
        try {
            return victims.purgeRetired(now, Duration.ofSeconds(config.getRetentionSeconds()));
        } finally {
            stateLock.readLock().unlock();
        }
    }

    @Override
    public List<RouteSolution> getRoutes() {
        stateLock.readLock().lock();
        try {
            return new ArrayList<>(activeRoutes.values());
        } finally {
            stateLock.readLock().unlock();
        }
    }

    @Override
    public List<Victim> getVictims() {
        if (scoresStale.getAndSet(false)) {
            rescore(victims.activeVictims(), clock.instant());
        }
        List<Victim> all = victims.allVictims();
        all.sort(BY_PRIORITY);
        return all;
    }

    @Override
    public SystemStatus getSystemStatus() {
        List<Victim> active;
        List<Responder> fleet;
        stateLock.readLock().lock();
        try {
            active = victims.activeVictims();
            fleet = responders.all();
        } finally {
            stateLock.readLock().unlock();
        }

        int available = 0;
        int enroute = 0;
        for (Responder responder : fleet) {
            if (responder.getStatus() == ResponderStatus.AVAILABLE) {
                available++;
            } else if (responder.getStatus() == ResponderStatus.ENROUTE) {
                enroute++;
            }
        }
        double survivalSum = 0.0;
        for (Victim victim : active) {
            survivalSum += victim.getSurvivalLikelihood();
        }
        double averageSurvival = active.isEmpty() ? 0.0 : survivalSum / active.size();
        PlanningResult last = lastResult;
        return new SystemStatus(active.size(), available, enroute, averageSurvival,
                last.getUnassignable().size(), last.isTimedOut());
    }

    @Override
    public List<UnassignableVictim> getUnassignable() {
        return lastResult.getUnassignable();
    }

    /**
     * Score and rank the given victims, storing the scores in the registry.
     */
    private List<ScoredVictim> rescore(List<Victim> active, Instant now) {
        List<ScoredVictim> ranked = scorer.rank(active, now);
        Map<String, Double> scores = new HashMap<>();
        for (ScoredVictim scored : ranked) {
            scores.put(scored.getId(), scored.getScore());
        }
        victims.updateScores(scores);
        return ranked;
    }

    /**
     * Apply planner output. Solutions whose responder or victims changed while planning are
     * skipped; their victims stay in the pool for the next pass.
     */
    private List<RouteSolution> apply(List<RouteSolution> solutions) {
        List<RouteSolution> applied = new ArrayList<>();
        stateLock.writeLock().lock();
        try {
            for (RouteSolution solution : solutions) {
                if (!stillApplicable(solution)) {
                    LOG.info(() -> "Skipping stale route for responder " + solution.getResponderId());
                    scoresStale.set(true);
                    continue;
                }
                responders.setRoute(solution.getResponderId(), solution.getOrderedVictimIds());
                victims.assign(solution.getOrderedVictimIds(), solution.getResponderId());
                activeRoutes.put(solution.getResponderId(), solution);
                applied.add(solution);
                LOG.info(() -> "Dispatched " + solution);
            }
        } finally {
            stateLock.writeLock().unlock();
        }
        return applied;
    }

    /**
     * Caller must hold the state write lock.
     */
    private boolean stillApplicable(RouteSolution solution) {
        Responder responder = responders.get(solution.getResponderId());
        if (responder == null || !responder.isAvailable()
                || responder.getCapacity() < solution.getOrderedVictimIds().size()) {
            return false;
        }
        for (String victimId : solution.getOrderedVictimIds()) {
            Victim victim = victims.get(victimId);
            if (victim == null || !victim.isActive() || victim.isAssigned()) {
                return false;
            }
        }
        return true;
    }

    private void publish(List<RouteSolution> routes) {
        try {
            if (!publisher.publish(routes)) {
                LOG.warning("Route publication was not accepted");
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Route publication failed", e);
        }
    }

    private void logOutcome(PlanningResult result) {
        if (result.isTimedOut()) {
            LOG.warning(() -> String.format("Planning hit its %d ms budget, keeping partial result: %s",
                    config.getPlanningTimeBudgetMillis(), result));
        }
        if (!result.getUnassignable().isEmpty()) {
            LOG.info(() -> "Unassignable victims: " + result.getUnassignable());
        }
    }
}
