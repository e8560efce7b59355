package com.newsrelay.core.model;

import com.newsrelay.core.util.HashingUtils;

import java.time.Instant;
import java.util.Objects;

/**
 * Normalized news item produced by every source adapter.
 *
 * <p>{@code id} is the fingerprint of {@code (title, link)}; two fetches of the same
 * underlying item yield the same id. {@code summary}, {@code publishedAt},
 * {@code rawPublished} and {@code imageUrl} are optional.
 */
public record Article(
        String id,
        String title,
        String link,
        String summary,
        Instant publishedAt,
        String rawPublished,
        String section,
        String imageUrl,
        String sourceName
) {
    public Article {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(link, "link is required");
        Objects.requireNonNull(sourceName, "sourceName is required");
    }

    public static Article of(
            String title,
            String link,
            String summary,
            Instant publishedAt,
            String rawPublished,
            String section,
            String imageUrl,
            String sourceName
    ) {
        return new Article(
                HashingUtils.fingerprint(title, link),
                title,
                link,
                summary,
                publishedAt,
                rawPublished,
                section,
                imageUrl,
                sourceName
        );
    }

    public Article withSection(String newSection) {
        return new Article(id, title, link, summary, publishedAt, rawPublished, newSection, imageUrl, sourceName);
    }

    public boolean hasSummary() {
        return summary != null && !summary.isBlank();
    }

    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }
}
