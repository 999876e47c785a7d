package org.rescueswarm.engine.scheduler;

import org.rescueswarm.engine.domain.model.RouteSolution;
import org.rescueswarm.engine.domain.service.DispatchCoordinator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduler for periodic dispatch cycles.
 * Each cycle expires stale victims, purges retired records and replans.
 * Immediate cycles can be requested, e.g. when a new victim appears.
 */
public final class DispatchScheduler {

    private static final Logger LOG = Logger.getLogger(DispatchScheduler.class.getName());

    private final ScheduledExecutorService executor;
    private final DispatchCoordinator coordinator;
    private final int intervalSeconds;
    private final Clock clock;
    private final AtomicBoolean replanPending = new AtomicBoolean(false);
    private volatile boolean running = false;

    public DispatchScheduler(DispatchCoordinator coordinator, int intervalSeconds) {
        this(coordinator, intervalSeconds, Clock.systemUTC());
    }

    public DispatchScheduler(DispatchCoordinator coordinator, int intervalSeconds, Clock clock) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be at least 1");
        }
        this.intervalSeconds = intervalSeconds;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dispatch-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            LOG.warning("Scheduler already running");
            return;
        }

        LOG.info(() -> "Starting dispatch scheduler with interval: " + intervalSeconds + "s");

        executor.scheduleAtFixedRate(
                this::runDispatchCycle,
                intervalSeconds, // Initial delay
                intervalSeconds, // Period
                TimeUnit.SECONDS
        );

        running = true;
    }

    /**
     * Stop the scheduler.
     */
    public void stop() {
        if (!running) {
            return;
        }

        LOG.info("Stopping dispatch scheduler");
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        running = false;
    }

    /**
     * Check if the scheduler is running.
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * Queue an immediate cycle. Requests arriving while one is already queued are coalesced.
     *
     * @return true if a new cycle was queued
     */
    public boolean requestReplan() {
        if (!running) {
            LOG.fine("Replan requested while scheduler is stopped, ignoring");
            return false;
        }
        if (!replanPending.compareAndSet(false, true)) {
            return false;
        }
        executor.execute(() -> {
            replanPending.set(false);
            runDispatchCycle();
        });
        return true;
    }

    /**
     * Run a single dispatch cycle.
     */
    void runDispatchCycle() {
        try {
            LOG.fine("Running dispatch cycle");
            Instant now = clock.instant();
            List<String> expired = coordinator.expireStale(now);
            if (!expired.isEmpty()) {
                LOG.info(() -> "Expired stale victims: " + expired);
            }
            int purged = coordinator.purgeRetired(now);
            if (purged > 0) {
                LOG.fine(() -> "Purged " + purged + " retired victims");
            }
            List<RouteSolution> routes = coordinator.replan(now);
            LOG.fine(() -> "Dispatch cycle completed: " + routes.size() + " active routes");
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Error in dispatch cycle", e);
        }
    }
}
