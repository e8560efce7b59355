package com.newsrelay.core.events;

import java.time.Instant;

public record CycleStarted(Instant timestamp, String groupName) implements Event {
    @Override
    public String type() {
        return "CycleStarted";
    }
}
