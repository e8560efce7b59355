package com.newsrelay.service.delivery;

import java.util.Objects;

public record DeliveryPayload(
        String articleId,
        String sourceName,
        String destinationId,
        String text,
        String imageUrl
) {
    public DeliveryPayload {
        Objects.requireNonNull(destinationId, "destinationId is required");
        Objects.requireNonNull(text, "text is required");
    }
}
