package com.newsrelay.service.support;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.fetch.Backoff;
import com.newsrelay.collectors.fetch.FetchChain;
import com.newsrelay.collectors.fetch.FetchStrategies;
import com.newsrelay.collectors.fetch.RotatingHttpSession;
import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.model.Article;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

public final class TestContexts {
    private TestContexts() {
    }

    public static CollectorContext collectorContext(EventBus bus, Clock clock) {
        FetchChain chain = new FetchChain(
                new RotatingHttpSession(() -> HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(), 20),
                new RecordingSleeper(),
                Backoff.none(),
                16
        );
        return new CollectorContext(chain, new FetchStrategies(Duration.ofSeconds(2)), bus, clock);
    }

    public static Article article(String sourceName, String title, String link) {
        return Article.of(title, link, "Summary for " + title, null, null, "STOCK-MARKET", null, sourceName);
    }
}
