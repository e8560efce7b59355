package com.newsrelay.service.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrelay.core.util.JsonUtils;
import com.newsrelay.service.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HealthServerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
    private final HealthState health = new HealthState(clock, 2, Duration.ofHours(1));
    private final HealthServer server = new HealthServer(0, health, () -> Map.of("storeSize", 42));
    private final HttpClient client = HttpClient.newHttpClient();

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void healthReflectsStateAsStatusCode() throws Exception {
        server.start();

        HttpResponse<String> healthy = get("/health");
        assertEquals(200, healthy.statusCode());
        assertEquals("healthy", JsonUtils.objectMapper().readTree(healthy.body()).path("status").asText());

        health.recordDeliveryFailure("TRANSIENT", clock.instant());
        health.recordDeliveryFailure("TRANSIENT", clock.instant());

        HttpResponse<String> unhealthy = get("/health");
        assertEquals(503, unhealthy.statusCode());
        JsonNode body = JsonUtils.objectMapper().readTree(unhealthy.body());
        assertEquals(2, body.path("consecutiveFailures").asInt());
        assertEquals(2, body.path("errors").path("delivery:TRANSIENT").path("count").asInt());
    }

    @Test
    void servesMetricsAndRejectsOtherMethods() throws Exception {
        server.start();

        HttpResponse<String> metrics = get("/metrics");
        assertEquals(200, metrics.statusCode());
        assertEquals(42, JsonUtils.objectMapper().readTree(metrics.body()).path("storeSize").asInt());

        HttpResponse<String> post = client.send(
                HttpRequest.newBuilder(uri("/health")).POST(HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(405, post.statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.actualPort() + path);
    }
}
