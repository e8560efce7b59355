package com.newsrelay.service.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Bot API target: {@code sendPhoto} with a caption when an image is present and the text
 * fits in a caption, {@code sendMessage} otherwise. A photo rejected as PERMANENT is resent
 * as plain text.
 */
public class TelegramDeliveryTarget implements DeliveryTarget {
    private static final Logger LOGGER = Logger.getLogger(TelegramDeliveryTarget.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    public static final int CAPTION_LIMIT = 1024;
    public static final int MESSAGE_LIMIT = 4096;

    private final HttpClient httpClient;
    private final String apiBaseUrl;
    private final String botToken;
    private final Duration requestTimeout;

    public TelegramDeliveryTarget(HttpClient httpClient, String apiBaseUrl, String botToken, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.botToken = botToken;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return "telegram";
    }

    @Override
    public void send(String destinationId, String text, String imageUrl) {
        if (imageUrl != null && !imageUrl.isBlank() && text.length() <= CAPTION_LIMIT) {
            ObjectNode photo = MAPPER.createObjectNode()
                    .put("chat_id", destinationId)
                    .put("photo", imageUrl)
                    .put("caption", text);
            try {
                call("sendPhoto", photo);
                return;
            } catch (DeliveryException e) {
                if (e.kind() != DeliveryFailureKind.PERMANENT) {
                    throw e;
                }
                LOGGER.warning("sendPhoto rejected (" + e.getMessage() + "); falling back to text");
            }
        }
        ObjectNode message = MAPPER.createObjectNode()
                .put("chat_id", destinationId)
                .put("text", text.length() > MESSAGE_LIMIT ? text.substring(0, MESSAGE_LIMIT - 3) + "..." : text)
                .put("disable_web_page_preview", true);
        call("sendMessage", message);
    }

    /**
     * Sends a plain text message outside the delivery pipeline, e.g. the startup notice.
     */
    public void announce(String destinationId, String text) {
        send(destinationId, text, null);
    }

    private void call(String method, ObjectNode body) {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(apiBaseUrl + "/bot" + botToken + "/" + method))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new DeliveryException(DeliveryFailureKind.TRANSIENT, method + " timed out", null, e);
        } catch (IOException e) {
            throw new DeliveryException(DeliveryFailureKind.TRANSIENT, method + " I/O error: " + e.getMessage(), null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(DeliveryFailureKind.TRANSIENT, method + " interrupted", null, e);
        }
        classify(method, response.statusCode(), response.body());
    }

    static void classify(String method, int status, String body) {
        JsonNode json = parse(body);
        String description = json.path("description").asText("HTTP " + status);
        JsonNode retryAfter = json.path("parameters").path("retry_after");
        if (status == 429 || retryAfter.canConvertToLong() && retryAfter.asLong() > 0) {
            Duration wait = retryAfter.canConvertToLong() ? Duration.ofSeconds(retryAfter.asLong()) : null;
            throw DeliveryException.rateLimited(method + " rate limited: " + description, wait);
        }
        if (status >= 500) {
            throw new DeliveryException(DeliveryFailureKind.TRANSIENT, method + " server error: " + description);
        }
        if (status >= 400) {
            throw new DeliveryException(DeliveryFailureKind.PERMANENT, method + " rejected: " + description);
        }
        if (!json.path("ok").asBoolean(false)) {
            throw new DeliveryException(DeliveryFailureKind.PERMANENT, method + " not ok: " + description);
        }
    }

    private static JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            return MAPPER.createObjectNode().put("description", body.length() > 200 ? body.substring(0, 200) : body);
        }
    }
}
