package com.newsrelay.service.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Translates through an OpenAI-compatible chat completions endpoint. Text shorter than
 * {@value #MIN_LENGTH} chars, or already mostly Arabic when Arabic is the target, is
 * returned unchanged.
 */
public class ChatCompletionTranslator implements Translator {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    static final int MIN_LENGTH = 10;
    static final double ARABIC_RATIO = 0.7;

    private final HttpClient httpClient;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final String targetLanguage;
    private final Duration timeout;

    public ChatCompletionTranslator(
            HttpClient httpClient,
            String endpoint,
            String apiKey,
            String model,
            String targetLanguage,
            Duration timeout
    ) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.targetLanguage = targetLanguage;
        this.timeout = timeout;
    }

    @Override
    public String translate(String text, String contextHint) {
        if (text == null || text.trim().length() < MIN_LENGTH) {
            return text;
        }
        if ("arabic".equalsIgnoreCase(targetLanguage) && arabicRatio(text) > ARABIC_RATIO) {
            return text;
        }

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(requestBody(text, contextHint))))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TranslationException("Translation request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Translation interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new TranslationException("Translation endpoint returned HTTP " + response.statusCode());
        }
        try {
            JsonNode content = MAPPER.readTree(response.body()).path("choices").path(0).path("message").path("content");
            String translated = content.asText("").trim();
            if (translated.isEmpty()) {
                throw new TranslationException("Translation response had no content");
            }
            return translated;
        } catch (IOException e) {
            throw new TranslationException("Unreadable translation response", e);
        }
    }

    private ObjectNode requestBody(String text, String contextHint) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", model);
        body.put("temperature", 0.2);
        body.put("max_tokens", 1000);
        ArrayNode messages = body.putArray("messages");
        messages.addObject()
                .put("role", "system")
                .put("content", "You are a professional financial news translator. Translate the user's "
                        + contextHint + " into " + targetLanguage
                        + ". Keep tickers, numbers and company names accurate. Reply with the translation only.");
        messages.addObject()
                .put("role", "user")
                .put("content", text);
        return body;
    }

    static double arabicRatio(String text) {
        long letters = text.codePoints().filter(Character::isLetter).count();
        if (letters == 0) {
            return 0;
        }
        long arabic = text.codePoints()
                .filter(Character::isLetter)
                .filter(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.ARABIC)
                .count();
        return (double) arabic / letters;
    }
}
