package com.iksanov.coherentcache.core.metrics;

import com.iksanov.coherentcache.common.exception.TransientStoreException;
import com.iksanov.coherentcache.core.config.CoherenceConfig;
import com.iksanov.coherentcache.core.store.AtomicStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
@DisplayName("MetricsServer - /metrics and /health endpoints")
class MetricsServerTest {

    @Mock
    private AtomicStore store;

    private CoherenceMetrics metrics;
    private MetricsServer server;
    private final HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

    @BeforeEach
    void setUp() {
        metrics = new CoherenceMetrics();
        server = new MetricsServer(0, metrics, store);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.shutdown();
    }

    @Test
    @DisplayName("/metrics returns Prometheus text")
    void shouldServeMetrics() throws Exception {
        metrics.recordHit();

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("coherence_get_hits_total");
    }

    @Test
    @DisplayName("/health is UP when the store answers")
    void shouldReportUp() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("/health is 503 when the store is unreachable")
    void shouldReportDown() throws Exception {
        doThrow(new TransientStoreException("down")).when(store).ping();

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.body()).contains("DOWN");
    }

    @Test
    @DisplayName("Unknown path returns 404")
    void shouldReturnNotFound() throws Exception {
        assertThat(get("/nope").statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("fromConfig() binds the configured metrics port")
    void shouldBindConfiguredPort() throws Exception {
        CoherenceConfig config = CoherenceConfig.fromEnv(Map.of("COHERENCE_METRICS_PORT", "0"));
        MetricsServer configured = MetricsServer.fromConfig(config, metrics, store);
        configured.start();
        try {
            HttpRequest request = HttpRequest.newBuilder(
                    URI.create("http://127.0.0.1:" + configured.boundPort() + "/health")).GET().build();

            assertThat(http.send(request, HttpResponse.BodyHandlers.ofString()).statusCode()).isEqualTo(200);
            assertThat(configured.boundPort()).isNotEqualTo(server.boundPort());
        } finally {
            configured.shutdown();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.boundPort() + path)).GET().build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
