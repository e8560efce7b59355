package com.newsrelay.collectors.fetch;

import java.util.Objects;

public record FetchResult(String payload, String strategyUsed, int status, String finalUrl) {
    public FetchResult {
        Objects.requireNonNull(payload, "payload is required");
        Objects.requireNonNull(strategyUsed, "strategyUsed is required");
    }
}
