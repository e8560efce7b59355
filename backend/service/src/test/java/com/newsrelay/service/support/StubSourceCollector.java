package com.newsrelay.service.support;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.api.CollectorResult;
import com.newsrelay.collectors.source.SourceCollector;
import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.SourceConfig;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Returns canned articles per source name without touching the network.
 */
public class StubSourceCollector extends SourceCollector {
    private final Map<String, List<Article>> articlesBySource = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failuresBySource = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();

    public StubSourceCollector returning(String sourceName, List<Article> articles) {
        articlesBySource.put(sourceName, List.copyOf(articles));
        return this;
    }

    public StubSourceCollector throwing(String sourceName, RuntimeException failure) {
        failuresBySource.put(sourceName, failure);
        return this;
    }

    @Override
    public CollectorResult collect(SourceConfig source, CollectorContext ctx) {
        calls.incrementAndGet();
        RuntimeException failure = failuresBySource.get(source.sourceName());
        if (failure != null) {
            throw failure;
        }
        List<Article> articles = articlesBySource.getOrDefault(source.sourceName(), List.of());
        return CollectorResult.success(source.sourceName(), "stub", articles, Map.of("articles", articles.size()));
    }

    public int calls() {
        return calls.get();
    }
}
