package org.rescueswarm.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.rescueswarm.engine.api.dto.DashboardDto;
import org.rescueswarm.engine.api.dto.DetectionDto;
import org.rescueswarm.engine.api.dto.ResponderStatusDto;
import org.rescueswarm.engine.api.dto.RoutesDto;
import org.rescueswarm.engine.api.dto.SystemStatusDto;
import org.rescueswarm.engine.api.dto.VictimDto;
import org.rescueswarm.engine.domain.CapacityExceededException;
import org.rescueswarm.engine.domain.ValidationException;
import org.rescueswarm.engine.domain.model.DetectionResult;
import org.rescueswarm.engine.domain.model.RouteSolution;
import org.rescueswarm.engine.domain.model.Victim;
import org.rescueswarm.engine.domain.service.DispatchCoordinator;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP surface of the engine.
 * Accepts detections and responder reports, exposes routes, victims and status,
 * and lets operators trigger a replan.
 */
public final class DispatchHttpServer {

    private static final Logger LOG = Logger.getLogger(DispatchHttpServer.class.getName());

    private static final String RESPONDERS_PREFIX = "/responders/";
    private static final String COMPLETE_SUFFIX = "/complete";

    private final HttpServer server;
    private final ExecutorService executor;
    private final DispatchCoordinator coordinator;
    private final ObjectMapper mapper;
    private final Clock clock;

    public DispatchHttpServer(int port, DispatchCoordinator coordinator) throws IOException {
        this(port, coordinator, new ObjectMapper(), Clock.systemUTC());
    }

    public DispatchHttpServer(int port, DispatchCoordinator coordinator, ObjectMapper mapper, Clock clock)
            throws IOException {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "HTTP server initialized on port " + getPort());
    }

    private void registerHandlers() {
        server.createContext("/health", exchange -> handle(exchange, "GET", this::handleHealth));
        server.createContext("/routes", exchange -> handle(exchange, "GET", this::handleRoutes));
        server.createContext("/routes/update", exchange -> handle(exchange, "POST", this::handleRoutesUpdate));
        server.createContext("/victims", exchange -> handle(exchange, "GET", this::handleVictims));
        server.createContext("/status", exchange -> handle(exchange, "GET", this::handleStatus));
        server.createContext("/dashboard/data", exchange -> handle(exchange, "GET", this::handleDashboard));
        server.createContext("/detections", exchange -> handle(exchange, "POST", this::handleDetection));
        server.createContext("/responders", exchange -> handle(exchange, "POST", this::handleResponders));
    }

    /**
     * Start the HTTP server.
     */
    public void start() {
        server.start();
        LOG.info("HTTP server started");
    }

    /**
     * Stop the HTTP server.
     */
    public void stop() {
        server.stop(1);
        executor.shutdownNow();
        LOG.info("HTTP server stopped");
    }

    /**
     * Bound port; differs from the requested one when started on port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }

    /**
     * Method check and error mapping shared by every endpoint.
     */
    private void handle(HttpExchange exchange, String method, Handler handler) throws IOException {
        try {
            if (!method.equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "method not allowed");
                return;
            }
            handler.handle(exchange);
        } catch (ValidationException e) {
            LOG.warning(() -> "Rejected request to " + exchange.getRequestURI() + ": " + e.getMessage());
            sendError(exchange, 400, e.getMessage());
        } catch (JsonProcessingException e) {
            LOG.warning(() -> "Malformed JSON on " + exchange.getRequestURI() + ": " + e.getOriginalMessage());
            sendError(exchange, 400, "malformed JSON");
        } catch (CapacityExceededException e) {
            LOG.warning(() -> "Capacity violation on " + exchange.getRequestURI() + ": " + e.getMessage());
            sendError(exchange, 409, e.getMessage());
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Request failed: " + exchange.getRequestURI(), e);
            sendError(exchange, 500, "internal error");
        } finally {
            exchange.close();
        }
    }

    /**
     * GET /health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        sendResponse(exchange, 200, "{\"status\":\"healthy\"}");
    }

    /**
     * GET /routes
     */
    private void handleRoutes(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, RoutesDto.from(coordinator.getRoutes(), clock.instant().toString()));
    }

    /**
     * POST /routes/update
     */
    private void handleRoutesUpdate(HttpExchange exchange) throws IOException {
        Instant now = clock.instant();
        LOG.info("Received replan request");
        List<RouteSolution> routes = coordinator.replan(now);
        sendJson(exchange, 200, RoutesDto.from(routes, now.toString()));
    }

    /**
     * GET /victims
     */
    private void handleVictims(HttpExchange exchange) throws IOException {
        List<VictimDto> body = new ArrayList<>();
        for (Victim victim : coordinator.getVictims()) {
            body.add(VictimDto.from(victim));
        }
        sendJson(exchange, 200, body);
    }

    /**
     * GET /status
     */
    private void handleStatus(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, SystemStatusDto.from(coordinator.getSystemStatus()));
    }

    /**
     * GET /dashboard/data
     * Read-only; does not trigger a planning pass.
     */
    private void handleDashboard(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, DashboardDto.from(coordinator.getSystemStatus(), coordinator.getVictims(),
                coordinator.getRoutes(), clock.instant().toString()));
    }

    /**
     * POST /detections
     */
    private void handleDetection(HttpExchange exchange) throws IOException {
        DetectionDto dto = readBody(exchange, DetectionDto.class);
        DetectionResult result = coordinator.onDetection(dto.toDomain(clock.instant()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("victim_id", result.getVictimId());
        body.put("created", result.isCreated());
        sendJson(exchange, result.isCreated() ? 201 : 200, body);
    }

    /**
     * POST /responders and POST /responders/{id}/complete
     */
    private void handleResponders(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if ("/responders".equals(path) || "/responders/".equals(path)) {
            ResponderStatusDto dto = readBody(exchange, ResponderStatusDto.class);
            coordinator.onResponderStatus(dto.toDomain());
            sendResponse(exchange, 200, "{\"status\":\"updated\"}");
            return;
        }

        String responderId = extractResponderId(path);
        if (responderId == null) {
            sendError(exchange, 404, "not found");
            return;
        }
        LOG.info(() -> "Received route completion for responder: " + responderId);
        List<String> served = coordinator.onRouteCompletion(responderId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("responder_id", responderId);
        body.put("served", served);
        sendJson(exchange, 200, body);
    }

    /**
     * Extract responder ID from a path like /responders/{id}/complete
     */
    static String extractResponderId(String path) {
        if (path == null || !path.startsWith(RESPONDERS_PREFIX)) {
            return null;
        }
        String rest = path.substring(RESPONDERS_PREFIX.length());
        if (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        if (!rest.endsWith(COMPLETE_SUFFIX)) {
            return null;
        }
        String id = rest.substring(0, rest.length() - COMPLETE_SUFFIX.length());
        return id.isEmpty() || id.contains("/") ? null : id;
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            T value = mapper.readValue(in, type);
            if (value == null) {
                throw new ValidationException("request body is required");
            }
            return value;
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        sendResponse(exchange, statusCode, mapper.writeValueAsString(body));
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        sendResponse(exchange, statusCode, mapper.writeValueAsString(body));
    }

    /**
     * Send HTTP response.
     */
    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
