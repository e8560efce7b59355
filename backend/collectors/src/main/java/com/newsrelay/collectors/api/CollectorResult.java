package com.newsrelay.collectors.api;

import com.newsrelay.core.model.Article;

import java.util.List;
import java.util.Map;

/**
 * Outcome of polling one source. A failed poll still carries the articles of any
 * endpoints that did succeed.
 */
public record CollectorResult(
        String sourceName,
        boolean success,
        String message,
        List<Article> articles,
        Map<String, Object> stats
) {
    public CollectorResult {
        articles = articles == null ? List.of() : List.copyOf(articles);
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    public static CollectorResult success(String sourceName, String message, List<Article> articles, Map<String, Object> stats) {
        return new CollectorResult(sourceName, true, message, articles, stats);
    }

    public static CollectorResult failure(String sourceName, String message, List<Article> articles, Map<String, Object> stats) {
        return new CollectorResult(sourceName, false, message, articles, stats);
    }
}
