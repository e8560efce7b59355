package com.newsrelay.service.health;

import com.newsrelay.core.util.JsonUtils;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * {@code GET /health} answers 200 or 503 with the health report; {@code GET /metrics}
 * returns the supplied metrics map.
 */
public class HealthServer {
    private static final Logger LOGGER = Logger.getLogger(HealthServer.class.getName());

    private final int port;
    private final HealthState healthState;
    private final Supplier<Map<String, Object>> metrics;

    private HttpServer server;
    private ExecutorService executor;

    public HealthServer(int port, HealthState healthState, Supplier<Map<String, Object>> metrics) {
        this.port = port;
        this.healthState = healthState;
        this.metrics = metrics;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(2);
            server.setExecutor(executor);
            server.createContext("/health", this::handleHealth);
            server.createContext("/metrics", this::handleMetrics);
            server.start();
            LOGGER.info("Health endpoint listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting health server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        Map<String, Object> report = healthState.report();
        writeJson(exchange, "healthy".equals(report.get("status")) ? 200 : 503, report);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, metrics.get());
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }
}
