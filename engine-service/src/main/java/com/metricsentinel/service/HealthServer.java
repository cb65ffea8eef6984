package com.metricsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.engine.AnomalyEngine;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health checks and the ingest endpoint.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – Returns {@code 200 OK} with body
 * {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} – {@code 200} while the engine scheduler runs,
 * {@code 503} otherwise</li>
 * <li>{@code POST /ingest} – One {@link IngestRequest}; {@code 202} when
 * stored, {@code 400} for a malformed body or a value the engine drops,
 * {@code 405} for other methods</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NOT_READY_RESPONSE = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] ACCEPTED_RESPONSE = "{\"status\":\"ACCEPTED\"}".getBytes(StandardCharsets.UTF_8);

    private final AnomalyEngine engine;
    private final IngestRequestParser parser;
    private final ObjectMapper errorMapper = new ObjectMapper();

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(AnomalyEngine engine, IngestRequestParser parser) {
        this.engine = Objects.requireNonNull(engine, "AnomalyEngine must not be null");
        this.parser = Objects.requireNonNull(parser, "IngestRequestParser must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
            throw new UncheckedIOException("Cannot bind health server to port " + port, e);
        }
        server.createContext("/health", HealthServer::handleHealth);
        server.createContext("/readiness", this::handleReadiness);
        server.createContext("/ingest", this::handleIngest);

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("Health server started on port {}", getPort());
    }

    /**
     * Stop the server, letting in-flight exchanges finish.
     *
     * @param delaySeconds maximum time to wait for in-flight exchanges
     */
    public void stop(int delaySeconds) {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(delaySeconds);
            executor.shutdown();
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Health server has not been started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealth(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (engine.isRunning()) {
            respond(exchange, 200, HEALTH_RESPONSE);
        } else {
            respond(exchange, 503, NOT_READY_RESPONSE);
        }
    }

    private void handleIngest(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "POST");
            respond(exchange, 405, error("Method not allowed: " + exchange.getRequestMethod()));
            return;
        }

        byte[] body;
        try (InputStream is = exchange.getRequestBody()) {
            body = is.readAllBytes();
        }

        try {
            IngestRequest request = parser.parse(body);
            boolean stored = engine.addDataPoint(request.getOrganizationId(), request.getResourceId(),
                    request.getMetricName(), request.getValue(), request.getMetadata());
            if (!stored) {
                respond(exchange, 400, error("Value rejected by engine: " + request.getValue()));
                return;
            }
        } catch (IllegalArgumentException e) {
            LOG.warn("Rejected ingest request: {}", e.getMessage());
            respond(exchange, 400, error(e.getMessage()));
            return;
        }
        respond(exchange, 202, ACCEPTED_RESPONSE);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private byte[] error(String message) throws JsonProcessingException {
        return errorMapper.writeValueAsBytes(Map.of("error", String.valueOf(message)));
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
