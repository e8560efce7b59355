package com.newsrelay.core.events;

import java.time.Instant;

public record DeliveryFailed(
        Instant timestamp,
        String articleId,
        String failureKind,
        String message,
        int attempts
) implements Event {
    @Override
    public String type() {
        return "DeliveryFailed";
    }
}
