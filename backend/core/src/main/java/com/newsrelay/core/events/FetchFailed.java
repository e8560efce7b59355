package com.newsrelay.core.events;

import java.time.Instant;

public record FetchFailed(
        Instant timestamp,
        String sourceName,
        String url,
        String failureKind,
        String message
) implements Event {
    @Override
    public String type() {
        return "FetchFailed";
    }
}
