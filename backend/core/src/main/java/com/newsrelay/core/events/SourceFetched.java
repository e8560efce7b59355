package com.newsrelay.core.events;

import java.time.Instant;

public record SourceFetched(
        Instant timestamp,
        String sourceName,
        String url,
        String strategy,
        int articleCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SourceFetched";
    }
}
