package com.metricsentinel.service;

import com.metricsentinel.core.config.EngineConfig;
import com.metricsentinel.core.engine.AnomalyEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests {@link HealthServer} over loopback HTTP.
 */
class HealthServerTest {

    private AnomalyEngine engine;
    private HealthServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        EngineConfig config = new EngineConfig();
        config.setSweepIntervalSeconds(3600);
        config.setCleanupIntervalMinutes(0);
        engine = new AnomalyEngine(config);
        server = new HealthServer(engine, new IngestRequestParser());
        server.start(0);
        client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        engine.close();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    @Test
    @DisplayName("Should answer the liveness check")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(server.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should report ready only while the engine is running")
    void shouldReportReadiness() throws Exception {
        assertThat(get("/readiness").statusCode()).isEqualTo(503);

        engine.start();

        assertThat(get("/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should accept a valid ingest request")
    void shouldAcceptIngest() throws Exception {
        HttpResponse<String> response = post("/ingest", "{\"organizationId\":\"org-1\",\"resourceId\":\"api\","
                + "\"metricName\":\"latency\",\"value\":120}");

        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(engine.getSeries("org-1", "api", "latency")).hasSize(1);
    }

    @Test
    @DisplayName("Should reject an invalid ingest request with a JSON error")
    void shouldRejectInvalidIngest() throws Exception {
        HttpResponse<String> response = post("/ingest", "{\"organizationId\":\"org-1\"}");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).contains("\"error\"").contains("resourceId");
        assertThat(engine.getServiceStats().getTotalDataPoints()).isZero();
    }

    @Test
    @DisplayName("Should reject a value that overflows to infinity")
    void shouldRejectInfiniteValue() throws Exception {
        HttpResponse<String> response = post("/ingest", "{\"organizationId\":\"o\",\"resourceId\":\"r\","
                + "\"metricName\":\"m\",\"value\":1e400}");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).contains("\"error\"").contains("finite");
        assertThat(engine.getSeries("o", "r", "m")).isEmpty();
    }

    @Test
    @DisplayName("Should answer 400 when the engine does not store the value")
    void shouldRejectValueDroppedByEngine() throws Exception {
        EngineConfig config = new EngineConfig();
        config.setCleanupIntervalMinutes(0);
        AnomalyEngine refusing = new AnomalyEngine(config) {
            @Override
            public boolean addDataPoint(String organizationId, String resourceId, String metricName,
                    double value, Map<String, Object> metadata) {
                return false;
            }
        };
        HealthServer refusingServer = new HealthServer(refusing, new IngestRequestParser());
        refusingServer.start(0);
        try {
            HttpRequest request = HttpRequest.newBuilder(
                            URI.create("http://localhost:" + refusingServer.getPort() + "/ingest"))
                    .POST(HttpRequest.BodyPublishers.ofString("{\"organizationId\":\"o\",\"resourceId\":\"r\","
                            + "\"metricName\":\"m\",\"value\":5}"))
                    .build();

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(response.body()).contains("rejected");
        } finally {
            refusingServer.stop(0);
            refusing.close();
        }
    }

    @Test
    @DisplayName("Should only allow POST on the ingest endpoint")
    void shouldRejectGetOnIngest() throws Exception {
        HttpResponse<String> response = get("/ingest");

        assertThat(response.statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should stop idempotently")
    void shouldStop() {
        server.stop(0);
        server.stop(0);

        assertThat(server.isRunning()).isFalse();
    }
}
