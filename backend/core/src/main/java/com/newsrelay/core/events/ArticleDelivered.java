package com.newsrelay.core.events;

import java.time.Instant;

public record ArticleDelivered(Instant timestamp, String articleId, String sourceName, int attempts) implements Event {
    @Override
    public String type() {
        return "ArticleDelivered";
    }
}
