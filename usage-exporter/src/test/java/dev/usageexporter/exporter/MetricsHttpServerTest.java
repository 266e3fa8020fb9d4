package dev.usageexporter.exporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dev.usageexporter.core.ExportedMetric;
import dev.usageexporter.core.Project;
import dev.usageexporter.core.Snapshot;
import dev.usageexporter.core.UsageMetric;
import dev.usageexporter.core.WeightTable;

@DisplayName("MetricsHttpServer")
class MetricsHttpServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private MetricsRegistry registry;
    private MetricsHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        registry = new MetricsRegistry();
        server = new MetricsHttpServer(0, registry, () -> null);
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + path))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Should serve the latest published snapshot")
    void shouldServeLatestSnapshot() throws Exception {
        Project project = new Project("p-1", "alpha-project", "d-1", "alpha");
        registry.publish(new Snapshot(List.of(
                new ExportedMetric(project, UsageMetric.TOTAL_MEMORY_MB_USAGE, 2048.0)),
                WeightTable.NEUTRAL, Instant.EPOCH));

        HttpResponse<String> response = send("GET", "/metrics");

        assertEquals(200, response.statusCode());
        assertEquals(PrometheusTextFormat.CONTENT_TYPE,
                response.headers().firstValue("Content-Type").orElse(""));
        assertTrue(response.body().contains("project_mb_usage{"));
        assertTrue(response.body().contains("project_id=\"p-1\""));
        assertTrue(response.body().contains("} 2048.0\n"));
    }

    @Test
    @DisplayName("Should serve no project series before the first update")
    void shouldServeBeforeFirstUpdate() throws Exception {
        HttpResponse<String> response = send("GET", "/metrics");

        assertEquals(200, response.statusCode());
        assertFalse(response.body().contains("project_vcpu_usage{"));
    }

    @Test
    @DisplayName("Should answer health checks")
    void shouldAnswerHealth() throws Exception {
        HttpResponse<String> response = send("GET", "/health");

        assertEquals(200, response.statusCode());
        assertEquals("OK", response.body());
    }

    @Test
    @DisplayName("Should reject writes to the scrape endpoint")
    void shouldRejectPost() throws Exception {
        HttpResponse<String> response = send("POST", "/metrics");

        assertEquals(405, response.statusCode());
    }

    @Test
    @DisplayName("Should not serve paths below /metrics")
    void shouldRejectUnknownPath() throws Exception {
        HttpResponse<String> response = send("GET", "/metrics/extra");

        assertEquals(404, response.statusCode());
    }
}
