package com.newsrelay.core.model;

import java.time.Instant;

public record DedupRecord(
        String id,
        String title,
        String link,
        Instant firstSeenAt,
        Instant lastSourceTimestamp
) {
    public static DedupRecord committed(Article article, Instant now) {
        return new DedupRecord(article.id(), article.title(), article.link(), now, article.publishedAt());
    }
}
