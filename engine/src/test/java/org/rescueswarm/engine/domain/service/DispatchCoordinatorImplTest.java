package org.rescueswarm.engine.domain.service;

import org.rescueswarm.engine.api.RoutePublisher;
import org.rescueswarm.engine.domain.geo.GeoCost;
import org.rescueswarm.engine.domain.model.Detection;
import org.rescueswarm.engine.domain.model.DetectionResult;
import org.rescueswarm.engine.domain.model.DispatchConfig;
import org.rescueswarm.engine.domain.model.GeoPoint;
import org.rescueswarm.engine.domain.model.InjuryLevel;
import org.rescueswarm.engine.domain.model.PlanningResult;
import org.rescueswarm.engine.domain.model.Responder;
import org.rescueswarm.engine.domain.model.ResponderStatus;
import org.rescueswarm.engine.domain.model.ResponderStatusUpdate;
import org.rescueswarm.engine.domain.model.RouteSolution;
import org.rescueswarm.engine.domain.model.SystemStatus;
import org.rescueswarm.engine.domain.model.UnassignableVictim;
import org.rescueswarm.engine.domain.model.Victim;
import org.rescueswarm.engine.domain.model.VictimStatus;
import org.rescueswarm.engine.domain.registry.ResponderRegistryImpl;
import org.rescueswarm.engine.domain.registry.VictimRegistryImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@Tag("unit")
@DisplayName("Dispatch Coordinator Tests")
class DispatchCoordinatorImplTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");
    private static final GeoPoint ORIGIN = GeoPoint.of(0.0, 0.0);

    @Mock
    private RoutePublisher publisher;

    private DispatchConfig config;
    private Clock clock;
    private VictimRegistryImpl victims;
    private ResponderRegistryImpl responders;
    private DispatchCoordinatorImpl coordinator;

    @BeforeEach
    void setUp() {
        config = DispatchConfig.defaults();
        clock = Clock.fixed(T0, ZoneOffset.UTC);
        victims = new VictimRegistryImpl(config.getMergeRadiusMeters(), clock);
        responders = new ResponderRegistryImpl();
        coordinator = newCoordinator(new GreedyRoutePlanner(GeoCost.from(config)));
    }

    private DispatchCoordinatorImpl newCoordinator(RoutePlanner planner) {
        return new DispatchCoordinatorImpl(victims, responders, new PriorityScorerImpl(config), planner,
                publisher, config, clock);
    }

    private String detect(String id, double lat, double lon, InjuryLevel level, double survival) {
        return coordinator.onDetection(new Detection(id, GeoPoint.of(lat, lon), level, survival, T0)).getVictimId();
    }

    private void responder(String id, GeoPoint at, int capacity, ResponderStatus status) {
        coordinator.onResponderStatus(new ResponderStatusUpdate(id, at, capacity, status));
    }

    @Test
    @DisplayName("Replan assigns victims, updates both registries and publishes")
    void testReplanAppliesRoutes() {
        detect("v-1", 0.0, 0.01, InjuryLevel.SEVERE, 0.6);
        detect("v-2", 0.0, 0.02, InjuryLevel.MINOR, 0.6);
        responder("r-1", ORIGIN, 5, ResponderStatus.AVAILABLE);

        List<RouteSolution> routes = coordinator.replan(T0);

        assertEquals(1, routes.size());
        assertEquals(Arrays.asList("v-1", "v-2"), routes.get(0).getOrderedVictimIds());

        Responder r1 = responders.get("r-1");
        assertEquals(ResponderStatus.ENROUTE, r1.getStatus());
        assertEquals(Arrays.asList("v-1", "v-2"), r1.getCurrentRoute());
        assertEquals("r-1", victims.get("v-1").getAssignedResponderId());
        assertEquals("r-1", victims.get("v-2").getAssignedResponderId());
        assertTrue(victims.get("v-1").getPriorityScore() > 0);

        verify(publisher).publish(routes);
        assertEquals(routes, coordinator.getRoutes());
    }

    @Test
    @DisplayName("Replanning an unchanged state returns the same routes and publishes once")
    void testReplanIdempotent() {
        detect("v-1", 0.0, 0.01, InjuryLevel.SEVERE, 0.6);
        responder("r-1", ORIGIN, 5, ResponderStatus.AVAILABLE);

        List<RouteSolution> first = coordinator.replan(T0);
        List<RouteSolution> second = coordinator.replan(T0);

        assertEquals(first, second);
        assertEquals("r-1", victims.get("v-1").getAssignedResponderId());
        verify(publisher, times(1)).publish(anyList());
    }

    @Test
    @DisplayName("Route completion serves the victims and frees the responder")
    void testRouteCompletion() {
        detect("v-1", 0.0, 0.01, InjuryLevel.SEVERE, 0.6);
        detect("v-2", 0.0, 0.02, InjuryLevel.MINOR, 0.6);
        responder("r-1", ORIGIN, 5, ResponderStatus.AVAILABLE);
        coordinator.replan(T0);

        List<String> served = coordinator.onRouteCompletion("r-1");

        assertEquals(Arrays.asList("v-1", "v-2"), served);
        assertEquals(VictimStatus.SERVED, victims.get("v-1").getStatus());
        assertEquals(VictimStatus.SERVED, victims.get("v-2").getStatus());
        assertEquals(ResponderStatus.AVAILABLE, responders.get("r-1").getStatus());
        assertTrue(coordinator.getRoutes().isEmpty());

        SystemStatus status = coordinator.getSystemStatus();
        assertEquals(0, status.getTotalActiveVictims());
        assertEquals(1, status.getAvailableResponders());

        assertTrue(coordinator.onRouteCompletion("r-1").isEmpty());
        assertTrue(coordinator.onRouteCompletion("unknown").isEmpty());
    }

    @Test
    @DisplayName("Responder leaving its route without completion releases the victims")
    void testAbandonedRouteReleased() {
        detect("v-1", 0.0, 0.01, InjuryLevel.SEVERE, 0.6);
        responder("r-1", ORIGIN, 5, ResponderStatus.AVAILABLE);
        coordinator.replan(T0);

        // position report while enroute keeps the route
        responder("r-1", GeoPoint.of(0.0, 0.005), 5, ResponderStatus.ENROUTE);
        assertEquals(1, coordinator.getRoutes().size());
        assertEquals("r-1", victims.get("v-1").getAssignedResponderId());

        responder("r-1", GeoPoint.of(0.0, 0.005), 5, ResponderStatus.UNAVAILABLE);
        assertTrue(coordinator.getRoutes().isEmpty());
        assertNull(victims.get("v-1").getAssignedResponderId());
        assertEquals(VictimStatus.ACTIVE, victims.get("v-1").getStatus());

        responder("r-2", ORIGIN, 2, ResponderStatus.AVAILABLE);
        List<RouteSolution> routes = coordinator.replan(T0.plusSeconds(60));
        assertEquals(1, routes.size());
        assertEquals("r-2", routes.get(0).getResponderId());
        assertEquals("r-2", victims.get("v-1").getAssignedResponderId());
    }

    @Test
    @DisplayName("System status averages survival and divides load by available responders")
    void testSystemStatus() {
        detect(null, 0.0, 0.01, InjuryLevel.MINOR, 0.2);
        detect(null, 0.0, 0.02, InjuryLevel.MINOR, 0.4);
        detect(null, 0.0, 0.03, InjuryLevel.MINOR, 0.9);

        SystemStatus noFleet = coordinator.getSystemStatus();
        assertEquals(3, noFleet.getTotalActiveVictims());
        assertEquals(0, noFleet.getAvailableResponders());
        assertEquals(0.5, noFleet.getAverageSurvivalLikelihood(), 1e-9);
        assertEquals(3.0, noFleet.getSystemLoad(), 1e-9);

        responder("r-1", ORIGIN, 1, ResponderStatus.AVAILABLE);
        responder("r-2", ORIGIN, 1, ResponderStatus.AVAILABLE);
        responder("r-3", ORIGIN, 1, ResponderStatus.UNAVAILABLE);

        SystemStatus withFleet = coordinator.getSystemStatus();
        assertEquals(2, withFleet.getAvailableResponders());
        assertEquals(1.5, withFleet.getSystemLoad(), 1e-9);
        assertEquals(0, withFleet.getEnrouteResponders());
    }

    @Test
    @DisplayName("Empty registries report zero average survival")
    void testSystemStatusEmpty() {
        SystemStatus status = coordinator.getSystemStatus();
        assertEquals(0, status.getTotalActiveVictims());
        assertEquals(0.0, status.getAverageSurvivalLikelihood());
        assertEquals(0.0, status.getSystemLoad());
        assertFalse(status.isLastPlanTimedOut());
    }

    @Test
    @DisplayName("Victims the pass could not place are surfaced in status")
    void testUnassignableSurfaced() {
        detect("v-1", 0.0, 0.01, InjuryLevel.SEVERE, 0.6);
        detect("v-2", 0.0, -0.01, InjuryLevel.MINOR, 0.6);
        responder("r-1", ORIGIN, 1, ResponderStatus.AVAILABLE);

        coordinator.replan(T0);

        assertEquals(Collections.singletonList(new UnassignableVictim("v-2", UnassignableVictim.Reason.NO_CAPACITY)),
                coordinator.getUnassignable());
        SystemStatus status = coordinator.getSystemStatus();
        assertEquals(1, status.getUnassignableVictims());
        assertEquals(1, status.getEnrouteResponders());
        assertEquals(VictimStatus.ACTIVE, victims.get("v-2").getStatus());
    }

    @Test
    @DisplayName("New victims trigger the listener, merged detections do not")
    void testNewVictimListener() {
        AtomicInteger calls = new AtomicInteger();
        coordinator.setNewVictimListener(calls::incrementAndGet);

        DetectionResult created = coordinator.onDetection(
                Detection.at(GeoPoint.of(0.0, 0.01), InjuryLevel.MINOR, 0.5, T0));
        DetectionResult merged = coordinator.onDetection(
                Detection.at(GeoPoint.of(0.0, 0.01), InjuryLevel.MINOR, 0.5, T0.plusSeconds(2)));

        assertTrue(created.isCreated());
        assertFalse(merged.isCreated());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Publisher failures do not undo applied routes")
    void testPublisherFailure() {
        when(publisher.publish(anyList())).thenThrow(new IllegalStateException("endpoint down"));
        detect("v-1", 0.0, 0.01, InjuryLevel.SEVERE, 0.6);
        responder("r-1", ORIGIN, 5, ResponderStatus.AVAILABLE);

        List<RouteSolution> routes = assertDoesNotThrow(() -> coordinator.replan(T0));

        assertEquals(1, routes.size());
        assertEquals("r-1", victims.get("v-1").getAssignedResponderId());
    }

    @Test
    @DisplayName("Nothing is published when the pass assigns nothing")
    void testNoPublishWithoutAssignments() {
        detect("v-1", 0.0, 0.01, InjuryLevel.SEVERE, 0.6);

        assertTrue(coordinator.replan(T0).isEmpty());
        verifyNoInteractions(publisher);
        assertEquals(UnassignableVictim.Reason.NO_RESPONDERS, coordinator.getUnassignable().get(0).getReason());
    }

    @Test
    @DisplayName("Solutions invalidated while planning are skipped")
    void testStaleSolutionSkipped() {
        RoutePlanner planner = mock(RoutePlanner.class);
        DispatchCoordinatorImpl racing = newCoordinator(planner);
        racing.onDetection(new Detection("v-1", GeoPoint.of(0.0, 0.01), InjuryLevel.SEVERE, 0.6, T0));
        racing.onResponderStatus(new ResponderStatusUpdate("r-1", ORIGIN, 5, ResponderStatus.AVAILABLE));

        when(planner.plan(anyList(), anyList(), any(), any())).thenAnswer(invocation -> {
            // responder goes offline while the pass is running
            racing.onResponderStatus(new ResponderStatusUpdate("r-1", ORIGIN, 5, ResponderStatus.UNAVAILABLE));
            RouteSolution solution = new RouteSolution("r-1", Collections.singletonList("v-1"), 1111.9, 800.0);
            return new PlanningResult(Collections.singletonList(solution), Collections.emptyList(), false);
        });

        assertTrue(racing.replan(T0).isEmpty());
        assertNull(victims.get("v-1").getAssignedResponderId());
        assertEquals(ResponderStatus.UNAVAILABLE, responders.get("r-1").getStatus());
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("Victims are listed by priority score, highest first")
    void testVictimsByPriority() {
        detect("v-low", 0.0, 0.01, InjuryLevel.NONE, 0.2);
        detect("v-high", 0.0, 0.02, InjuryLevel.UNCONSCIOUS, 0.9);
        detect("v-mid", 0.0, 0.03, InjuryLevel.MINOR, 0.5);

        List<Victim> listed = coordinator.getVictims();

        assertEquals(Arrays.asList("v-high", "v-mid", "v-low"),
                Arrays.asList(listed.get(0).getId(), listed.get(1).getId(), listed.get(2).getId()));
        assertEquals(135.0, listed.get(0).getPriorityScore(), 1e-9);
    }

    @Test
    @DisplayName("A detection landing while victims are rescored is scored on the next listing")
    void testDetectionDuringRescoreKeepsScoresStale() {
        PriorityScorer scorer = spy(new PriorityScorerImpl(config));
        DispatchCoordinatorImpl racing = new DispatchCoordinatorImpl(victims, responders, scorer,
                new GreedyRoutePlanner(GeoCost.from(config)), publisher, config, clock);
        racing.onDetection(new Detection("v-1", GeoPoint.of(0.0, 0.01), InjuryLevel.MINOR, 0.5, T0));

        AtomicBoolean injected = new AtomicBoolean();
        doAnswer(invocation -> {
            if (injected.compareAndSet(false, true)) {
                racing.onDetection(new Detection("v-2", GeoPoint.of(0.0, 0.02), InjuryLevel.UNCONSCIOUS, 0.9, T0));
            }
            return invocation.callRealMethod();
        }).when(scorer).rank(anyCollection(), any());

        racing.getVictims();
        List<Victim> listed = racing.getVictims();

        assertEquals("v-2", listed.get(0).getId());
        assertEquals(135.0, listed.get(0).getPriorityScore(), 1e-9);
        assertTrue(listed.get(1).getPriorityScore() > 0);
    }

    @Test
    @DisplayName("Completing a route republishes the remaining active routes")
    void testCompletionRepublishes() {
        detect("v-1", 0.0, 0.01, InjuryLevel.SEVERE, 0.6);
        responder("r-1", ORIGIN, 1, ResponderStatus.AVAILABLE);
        detect("v-2", 0.0, -0.01, InjuryLevel.SEVERE, 0.6);
        responder("r-2", ORIGIN, 1, ResponderStatus.AVAILABLE);
        List<RouteSolution> routes = coordinator.replan(T0);
        assertEquals(2, routes.size());
        RouteSolution remaining = routes.get(1);

        assertEquals(Collections.singletonList(routes.get(0).getOrderedVictimIds().get(0)),
                coordinator.onRouteCompletion(" r-1 "));

        assertEquals(Collections.singletonList(remaining), coordinator.getRoutes());
        verify(publisher).publish(Collections.singletonList(remaining));

        // a second completion changes nothing and publishes nothing
        coordinator.onRouteCompletion("r-1");
        verify(publisher, times(2)).publish(anyList());
    }

    @Test
    @DisplayName("Abandoning a route republishes the remaining active routes")
    void testAbandonRepublishes() {
        detect("v-1", 0.0, 0.01, InjuryLevel.SEVERE, 0.6);
        responder("r-1", ORIGIN, 5, ResponderStatus.AVAILABLE);
        coordinator.replan(T0);

        responder("r-1", ORIGIN, 5, ResponderStatus.UNAVAILABLE);

        verify(publisher).publish(Collections.emptyList());
        verify(publisher, times(2)).publish(anyList());
    }

    @Test
    @DisplayName("Expiry and purge use the configured windows")
    void testExpireAndPurge() {
        String stale = detect("v-1", 0.0, 0.01, InjuryLevel.MINOR, 0.5);

        assertTrue(coordinator.expireStale(T0.plus(Duration.ofHours(5))).isEmpty());
        assertEquals(Collections.singletonList(stale), coordinator.expireStale(T0.plus(Duration.ofHours(7))));
        assertEquals(0, coordinator.getSystemStatus().getTotalActiveVictims());

        assertEquals(0, coordinator.purgeRetired(T0.plus(Duration.ofHours(8))));
        assertEquals(1, coordinator.purgeRetired(T0.plus(Duration.ofHours(32))));
        assertTrue(coordinator.getVictims().isEmpty());
    }

    @Test
    @Timeout(20)
    @DisplayName("Concurrent ingestion during replanning never double-assigns a victim")
    void testConcurrentIngestionAndReplan() throws InterruptedException {
        for (int i = 0; i < 5; i++) {
            responder(String.format("r-%d", i), ORIGIN, 5, ResponderStatus.AVAILABLE);
        }

        int producers = 4;
        int perProducer = 50;
        ExecutorService pool = Executors.newFixedThreadPool(producers + 1);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(producers + 1);

        for (int p = 0; p < producers; p++) {
            final int producer = p;
            pool.execute(() -> {
                try {
                    start.await();
                    for (int k = 0; k < perProducer; k++) {
                        // ~111 m grid spacing keeps every detection a distinct victim
                        coordinator.onDetection(Detection.at(GeoPoint.of(0.001 * k, 0.001 * producer),
                                InjuryLevel.MINOR, 0.5, T0));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        pool.execute(() -> {
            try {
                start.await();
                for (int i = 0; i < 20; i++) {
                    coordinator.replan(T0);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });

        start.countDown();
        assertTrue(done.await(15, TimeUnit.SECONDS));
        pool.shutdownNow();

        List<RouteSolution> routes = coordinator.replan(T0);

        assertEquals(producers * perProducer, victims.size());
        Set<String> seen = new HashSet<>();
        for (RouteSolution route : routes) {
            assertTrue(route.getOrderedVictimIds().size() <= 5);
            assertEquals(route.getOrderedVictimIds(), responders.get(route.getResponderId()).getCurrentRoute());
            for (String id : route.getOrderedVictimIds()) {
                assertTrue(seen.add(id), "victim on two routes: " + id);
                assertEquals(route.getResponderId(), victims.get(id).getAssignedResponderId());
            }
        }
        long assignedInRegistry = victims.activeVictims().stream().filter(Victim::isAssigned).count();
        assertEquals(seen.size(), assignedInRegistry);
    }
}
