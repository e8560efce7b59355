package com.newsrelay.collectors.source;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.api.CollectorResult;
import com.newsrelay.collectors.api.ParseFailureException;
import com.newsrelay.collectors.api.SourceAdapter;
import com.newsrelay.collectors.filter.SectionClassifier;
import com.newsrelay.collectors.fetch.FetchFailureException;
import com.newsrelay.collectors.fetch.FetchResult;
import com.newsrelay.collectors.fetch.FetchStrategy;
import com.newsrelay.collectors.html.HtmlSourceAdapter;
import com.newsrelay.collectors.rss.RssSourceAdapter;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.FetchFailed;
import com.newsrelay.core.events.SourceFetched;
import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceKind;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Polls every endpoint of one source through the fetch chain and the adapter for its
 * kind. Fetch and parse failures never escape: they become an empty contribution plus a
 * {@link FetchFailed} or {@link AlertRaised} event.
 */
public class SourceCollector {
    private static final Logger LOGGER = Logger.getLogger(SourceCollector.class.getName());

    private final Map<SourceKind, SourceAdapter> adapters;
    private final SectionClassifier sectionClassifier;

    public SourceCollector() {
        this(List.of(new RssSourceAdapter(), new HtmlSourceAdapter()), new SectionClassifier());
    }

    public SourceCollector(List<SourceAdapter> adapters, SectionClassifier sectionClassifier) {
        this.adapters = new EnumMap<>(SourceKind.class);
        adapters.forEach(adapter -> this.adapters.put(adapter.kind(), adapter));
        this.sectionClassifier = sectionClassifier;
    }

    public CollectorResult collect(SourceConfig source, CollectorContext ctx) {
        SourceAdapter adapter = adapters.get(source.kind());
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for kind " + source.kind());
        }
        List<FetchStrategy> strategies = ctx.strategies().forSource(source);

        Map<String, Article> articles = new LinkedHashMap<>();
        int failures = 0;
        String lastError = null;
        for (String endpoint : source.endpoints()) {
            Instant startedAt = ctx.clock().instant();
            try {
                FetchResult fetched = ctx.fetchChain().fetch(endpoint, strategies);
                List<Article> parsed = adapter.parse(fetched.payload(), source, fetched.finalUrl());
                for (Article article : parsed) {
                    Article classified = source.autoSection() ? sectionClassifier.applyTo(article) : article;
                    articles.putIfAbsent(classified.id(), classified);
                }
                long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
                ctx.eventBus().publish(new SourceFetched(
                        ctx.clock().instant(),
                        source.sourceName(),
                        endpoint,
                        fetched.strategyUsed(),
                        parsed.size(),
                        durationMillis
                ));
            } catch (FetchFailureException e) {
                failures++;
                lastError = e.getMessage();
                LOGGER.warning("Fetch failed for " + source.sourceName() + " (" + endpoint + "): "
                        + e.kind() + " " + e.getMessage());
                ctx.eventBus().publish(new FetchFailed(
                        ctx.clock().instant(),
                        source.sourceName(),
                        endpoint,
                        e.kind().name(),
                        e.getMessage()
                ));
            } catch (ParseFailureException e) {
                failures++;
                lastError = e.getMessage();
                LOGGER.warning("Parse failed for " + source.sourceName() + " (" + endpoint + "): " + e.getMessage());
                ctx.eventBus().publish(new AlertRaised(
                        ctx.clock().instant(),
                        "parse",
                        e.getMessage(),
                        Map.of("source", source.sourceName(), "url", endpoint)
                ));
            }
        }

        Map<String, Object> stats = new HashMap<>();
        stats.put("endpoints", source.endpoints().size());
        stats.put("failures", failures);
        stats.put("articles", articles.size());
        List<Article> collected = List.copyOf(articles.values());
        if (failures == 0) {
            return CollectorResult.success(source.sourceName(), "Collected " + collected.size() + " articles", collected, stats);
        }
        return CollectorResult.failure(source.sourceName(), lastError, collected, stats);
    }
}
