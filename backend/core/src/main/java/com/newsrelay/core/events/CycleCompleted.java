package com.newsrelay.core.events;

import java.time.Instant;

public record CycleCompleted(
        Instant timestamp,
        String groupName,
        int fetched,
        int queued,
        int delivered,
        int failed,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CycleCompleted";
    }
}
