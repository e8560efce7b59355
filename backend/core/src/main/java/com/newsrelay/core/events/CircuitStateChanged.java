package com.newsrelay.core.events;

import java.time.Instant;

public record CircuitStateChanged(
        Instant timestamp,
        String target,
        String fromState,
        String toState,
        int failureCount
) implements Event {
    @Override
    public String type() {
        return "CircuitStateChanged";
    }
}
