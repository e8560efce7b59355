package com.newsrelay.collectors.fetch;

import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FetchStrategiesTest {
    private final FetchStrategies catalogue = new FetchStrategies(Duration.ofSeconds(5));

    @Test
    void resolvesNamedStrategiesInOrderAndSkipsUnknown() {
        SourceConfig source = new SourceConfig("site", SourceKind.HTML, List.of("https://www.example.com/news"),
                "https://mirror.example.com/news", null, List.of("crawler", "bogus", "alternate", "mobile"),
                false, null, null, null, 0, null);

        List<FetchStrategy> strategies = catalogue.forSource(source);

        assertEquals(List.of("crawler", "alternate", "mobile"), strategies.stream().map(FetchStrategy::name).toList());
        assertEquals(Duration.ofSeconds(10), strategies.get(0).timeout());
        assertEquals("https://mirror.example.com/news", strategies.get(1).targetUrl("https://www.example.com/news"));
        assertEquals("https://m.example.com/news", strategies.get(2).targetUrl("https://www.example.com/news"));
    }

    @Test
    void defaultsDependOnSourceKind() {
        assertEquals(List.of("feed", "direct"),
                catalogue.forSource(SourceConfig.rss("wire", "https://example.com/rss")).stream().map(FetchStrategy::name).toList());
        assertEquals(List.of("direct", "mobile", "crawler"),
                catalogue.forSource(SourceConfig.html("site", "https://example.com/")).stream().map(FetchStrategy::name).toList());
    }

    @Test
    void mobileRewriteOnlyTouchesWwwHosts() {
        assertEquals("https://m.example.com/a?b=www.c", FetchStrategies.mobileHost("https://www.example.com/a?b=www.c"));
        assertEquals("https://news.example.com/a", FetchStrategies.mobileHost("https://news.example.com/a"));
    }
}
