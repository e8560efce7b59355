package com.newsrelay.service.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrelay.core.util.JsonUtils;
import com.newsrelay.service.support.FakeHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramDeliveryTargetTest {
    private static final String OK = "{\"ok\":true,\"result\":{\"message_id\":1}}";

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Deque<Reply> replies = new ArrayDeque<>();
    private FakeHttpServer server;
    private TelegramDeliveryTarget target;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeHttpServer().route("/bot123:abc/", exchange -> {
            String method = exchange.getRequestURI().getPath().substring("/bot123:abc/".length());
            try (InputStream in = exchange.getRequestBody()) {
                calls.add(new Call(method, JsonUtils.objectMapper().readTree(new String(in.readAllBytes(), StandardCharsets.UTF_8))));
            }
            Reply reply;
            synchronized (replies) {
                reply = replies.isEmpty() ? new Reply(200, OK) : replies.poll();
            }
            FakeHttpServer.respond(exchange, reply.status(), reply.body());
        });
        target = new TelegramDeliveryTarget(HttpClient.newHttpClient(), server.url("/"), "123:abc", Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void sendsPlainMessageWithoutPreview() {
        target.send("@news", "Stocks close higher", null);

        assertEquals(1, calls.size());
        assertEquals("sendMessage", calls.get(0).method());
        assertEquals("@news", calls.get(0).body().path("chat_id").asText());
        assertEquals("Stocks close higher", calls.get(0).body().path("text").asText());
        assertTrue(calls.get(0).body().path("disable_web_page_preview").asBoolean());
    }

    @Test
    void sendsPhotoWithCaptionWhenImagePresent() {
        target.send("@news", "Gold hits record", "https://img.example.com/gold.jpg");

        assertEquals("sendPhoto", calls.get(0).method());
        assertEquals("https://img.example.com/gold.jpg", calls.get(0).body().path("photo").asText());
        assertEquals("Gold hits record", calls.get(0).body().path("caption").asText());
    }

    @Test
    void longTextSkipsThePhoto() {
        target.send("@news", "x".repeat(TelegramDeliveryTarget.CAPTION_LIMIT + 1), "https://img.example.com/a.jpg");

        assertEquals(1, calls.size());
        assertEquals("sendMessage", calls.get(0).method());
    }

    @Test
    void rejectedPhotoFallsBackToText() {
        reply(400, "{\"ok\":false,\"description\":\"Bad Request: wrong file identifier\"}");

        target.send("@news", "Oil slips", "https://img.example.com/broken.jpg");

        assertEquals(List.of("sendPhoto", "sendMessage"), calls.stream().map(Call::method).toList());
    }

    @Test
    void mapsRateLimitWithRetryAfter() {
        reply(429, "{\"ok\":false,\"description\":\"Too Many Requests\",\"parameters\":{\"retry_after\":12}}");

        DeliveryException ex = assertThrows(DeliveryException.class, () -> target.send("@news", "text", null));

        assertEquals(DeliveryFailureKind.RATE_LIMITED, ex.kind());
        assertEquals(Duration.ofSeconds(12), ex.retryAfter());
    }

    @Test
    void mapsServerErrorsAsTransientAndClientErrorsAsPermanent() {
        reply(502, "Bad Gateway");
        assertEquals(DeliveryFailureKind.TRANSIENT,
                assertThrows(DeliveryException.class, () -> target.send("@news", "text", null)).kind());

        reply(403, "{\"ok\":false,\"description\":\"Forbidden: bot was kicked\"}");
        DeliveryException forbidden = assertThrows(DeliveryException.class, () -> target.send("@news", "text", null));
        assertEquals(DeliveryFailureKind.PERMANENT, forbidden.kind());
        assertTrue(forbidden.getMessage().contains("bot was kicked"));
    }

    @Test
    void unreachableApiIsTransient() {
        server.close();

        DeliveryException ex = assertThrows(DeliveryException.class, () -> target.send("@news", "text", null));
        assertEquals(DeliveryFailureKind.TRANSIENT, ex.kind());
    }

    @Test
    void classifiesOkFalseOnSuccessStatusAsPermanent() {
        DeliveryException ex = assertThrows(DeliveryException.class,
                () -> TelegramDeliveryTarget.classify("sendMessage", 200, "{\"ok\":false,\"description\":\"odd\"}"));
        assertEquals(DeliveryFailureKind.PERMANENT, ex.kind());
    }

    private void reply(int status, String body) {
        synchronized (replies) {
            replies.add(new Reply(status, body));
        }
    }

    private record Call(String method, JsonNode body) {
    }

    private record Reply(int status, String body) {
    }
}
