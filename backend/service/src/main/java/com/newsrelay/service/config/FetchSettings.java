package com.newsrelay.service.config;

import java.time.Duration;

public record FetchSettings(
        Duration requestTimeout,
        Duration backoffBase,
        Duration backoffCap,
        int minPayloadBytes,
        int requestsPerSession
) {
    public FetchSettings {
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(15) : requestTimeout;
        backoffBase = backoffBase == null ? Duration.ofSeconds(2) : backoffBase;
        backoffCap = backoffCap == null ? Duration.ofSeconds(30) : backoffCap;
        minPayloadBytes = minPayloadBytes <= 0 ? 512 : minPayloadBytes;
        requestsPerSession = requestsPerSession <= 0 ? 25 : requestsPerSession;
    }

    public static FetchSettings defaults() {
        return new FetchSettings(null, null, null, 0, 0);
    }
}
