package com.newsrelay.service.config;

import java.time.Duration;

public record RuntimeSettings(Duration shutdownGrace) {
    public RuntimeSettings {
        shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(30) : shutdownGrace;
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(null);
    }
}
