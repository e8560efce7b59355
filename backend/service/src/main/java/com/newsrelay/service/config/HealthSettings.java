package com.newsrelay.service.config;

import java.time.Duration;

/**
 * {@code port} 0 disables the health endpoint.
 */
public record HealthSettings(int port, int unhealthyThreshold, Duration staleAfter) {
    public HealthSettings {
        port = Math.max(0, port);
        unhealthyThreshold = unhealthyThreshold <= 0 ? 5 : unhealthyThreshold;
        staleAfter = staleAfter == null ? Duration.ofHours(1) : staleAfter;
    }

    public static HealthSettings defaults() {
        return new HealthSettings(0, 0, null);
    }

    public HealthSettings withPort(int override) {
        return new HealthSettings(override, unhealthyThreshold, staleAfter);
    }
}
