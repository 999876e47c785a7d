package org.rescueswarm.engine;

import org.rescueswarm.engine.api.HttpRoutePublisher;
import org.rescueswarm.engine.api.LoggingRoutePublisher;
import org.rescueswarm.engine.api.RoutePublisher;
import org.rescueswarm.engine.config.EngineConfig;
import org.rescueswarm.engine.domain.geo.GeoCost;
import org.rescueswarm.engine.domain.model.DispatchConfig;
import org.rescueswarm.engine.domain.registry.ResponderRegistry;
import org.rescueswarm.engine.domain.registry.ResponderRegistryImpl;
import org.rescueswarm.engine.domain.registry.VictimRegistry;
import org.rescueswarm.engine.domain.registry.VictimRegistryImpl;
import org.rescueswarm.engine.domain.service.DispatchCoordinatorImpl;
import org.rescueswarm.engine.domain.service.GreedyRoutePlanner;
import org.rescueswarm.engine.domain.service.PriorityScorer;
import org.rescueswarm.engine.domain.service.PriorityScorerImpl;
import org.rescueswarm.engine.domain.service.RoutePlanner;
import org.rescueswarm.engine.http.DispatchHttpServer;
import org.rescueswarm.engine.scheduler.DispatchScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the rescue dispatch engine.
 *
 * The engine merges drone detections into a victim registry, ranks victims by
 * urgency and assigns them to responder routes within a bounded planning time.
 *
 * Trigger modes:
 * - Periodic: the scheduler replans every N seconds
 * - On new victim: an immediate cycle is queued when a detection creates a victim
 * - On demand: POST /routes/update
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== Rescue Swarm Dispatch Engine ===");

        EngineConfig config = EngineConfig.fromEnvironment();
        configureLogging(config);
        LOG.info(() -> "Configuration: " + config);

        DispatchConfig dispatchConfig = config.getDispatchConfig();
        Clock clock = Clock.systemUTC();

        VictimRegistry victimRegistry = new VictimRegistryImpl(dispatchConfig.getMergeRadiusMeters(), clock);
        ResponderRegistry responderRegistry = new ResponderRegistryImpl();
        PriorityScorer scorer = new PriorityScorerImpl(dispatchConfig);
        RoutePlanner planner = new GreedyRoutePlanner(GeoCost.from(dispatchConfig));
        RoutePublisher publisher = createPublisher(config);

        DispatchCoordinatorImpl coordinator = new DispatchCoordinatorImpl(victimRegistry, responderRegistry,
                scorer, planner, publisher, dispatchConfig, clock);

        DispatchHttpServer httpServer = new DispatchHttpServer(config.getHttpPort(), coordinator);
        httpServer.start();
        LOG.info(() -> "HTTP server started on port " + httpServer.getPort());

        DispatchScheduler scheduler = null;
        if (config.isSchedulerEnabled()) {
            scheduler = new DispatchScheduler(coordinator, config.getDispatchIntervalSeconds(), clock);
            scheduler.start();
            if (config.isReplanOnNewVictim()) {
                coordinator.setNewVictimListener(scheduler::requestReplan);
                LOG.info("Immediate replan on new victims enabled");
            }
        } else {
            LOG.info("Dispatch scheduler disabled");
        }

        final DispatchScheduler finalScheduler = scheduler;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            httpServer.stop();
            if (finalScheduler != null) {
                finalScheduler.stop();
            }
            LOG.info("Engine shutdown complete");
        }));

        int port = httpServer.getPort();
        LOG.info("=== Dispatch Engine started successfully ===");
        LOG.info("Endpoints:");
        LOG.info(() -> "  - Health: http://localhost:" + port + "/health");
        LOG.info(() -> "  - Detections: POST http://localhost:" + port + "/detections");
        LOG.info(() -> "  - Responders: POST http://localhost:" + port + "/responders");
        LOG.info(() -> "  - Completion: POST http://localhost:" + port + "/responders/{id}/complete");
        LOG.info(() -> "  - Routes: GET http://localhost:" + port + "/routes, POST /routes/update");
        LOG.info(() -> "  - Victims: GET http://localhost:" + port + "/victims");
        LOG.info(() -> "  - Status: GET http://localhost:" + port + "/status");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    private RoutePublisher createPublisher(EngineConfig config) {
        if (config.isRoutePublishingEnabled()) {
            LOG.info(() -> "Publishing routes to: " + config.getRoutePublishUrl());
            return new HttpRoutePublisher(config.getRoutePublishUrl());
        }
        LOG.info("ROUTE_PUBLISH_URL not set, routes will be logged only");
        return new LoggingRoutePublisher();
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
