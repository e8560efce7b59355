package com.newsrelay.service.config;

import java.time.Duration;

public record DeliverySettings(
        String apiBaseUrl,
        String botToken,
        String channelId,
        Integer maxRetries,
        Duration baseDelay,
        double backoffFactor,
        int failureThreshold,
        Duration coolDown,
        Duration minDeliveryInterval,
        Duration requestTimeout,
        boolean announceStartup
) {
    public DeliverySettings {
        apiBaseUrl = apiBaseUrl == null || apiBaseUrl.isBlank() ? "https://api.telegram.org" : apiBaseUrl;
        maxRetries = maxRetries == null || maxRetries < 0 ? 2 : maxRetries;
        baseDelay = baseDelay == null ? Duration.ofSeconds(1) : baseDelay;
        backoffFactor = backoffFactor <= 0 ? 2.0 : backoffFactor;
        failureThreshold = failureThreshold <= 0 ? 5 : failureThreshold;
        coolDown = coolDown == null ? Duration.ofSeconds(60) : coolDown;
        minDeliveryInterval = minDeliveryInterval == null ? Duration.ofSeconds(6) : minDeliveryInterval;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(15) : requestTimeout;
    }

    public static DeliverySettings defaults() {
        return new DeliverySettings(null, null, null, null, null, 0, 0, null, null, null, false);
    }

    public DeliverySettings withCredentials(String token, String channel) {
        return new DeliverySettings(apiBaseUrl, token, channel, maxRetries, baseDelay, backoffFactor,
                failureThreshold, coolDown, minDeliveryInterval, requestTimeout, announceStartup);
    }
}
