package com.newsrelay.service.runtime;

import com.newsrelay.collectors.filter.ArticleFilter;
import com.newsrelay.collectors.filter.KeywordTaxonomy;
import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.CycleCompleted;
import com.newsrelay.core.events.CycleStarted;
import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceGroupConfig;
import com.newsrelay.core.model.SourceKind;
import com.newsrelay.service.delivery.CircuitBreaker;
import com.newsrelay.service.delivery.DeliveryException;
import com.newsrelay.service.delivery.DeliveryFailureKind;
import com.newsrelay.service.delivery.DeliveryThrottle;
import com.newsrelay.service.delivery.DeliveryWorker;
import com.newsrelay.service.delivery.RetryPolicy;
import com.newsrelay.service.format.MessageFormatter;
import com.newsrelay.service.format.NoopTranslator;
import com.newsrelay.service.store.JsonFileDedupStore;
import com.newsrelay.service.support.EventCapture;
import com.newsrelay.service.support.MutableClock;
import com.newsrelay.service.support.RecordingSleeper;
import com.newsrelay.service.support.ScriptedDeliveryTarget;
import com.newsrelay.service.support.StubSourceCollector;
import com.newsrelay.service.support.TestContexts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.newsrelay.service.support.TestContexts.article;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceGroupPollerTest {
    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
    private final EventBus bus = new EventBus();
    private final EventCapture capture = new EventCapture(bus);
    private final ScriptedDeliveryTarget target = new ScriptedDeliveryTarget();
    private final StubSourceCollector collector = new StubSourceCollector();
    private JsonFileDedupStore store;

    @Test
    void failedDeliveryIsRetriedNextCycleAndCommittedExactlyOnce() {
        Article article = article("wire", "Stock market opens higher", "https://news.example.com/1");
        collector.returning("wire", List.of(article));
        target.failWith(new DeliveryException(DeliveryFailureKind.TRANSIENT, "connection reset"));
        SourceGroupPoller poller = poller(group(10, SourceConfig.rss("wire", "https://news.example.com/rss")));

        CycleReport first = poller.runCycle();
        assertEquals(1, first.queued());
        assertEquals(0, first.delivered());
        assertEquals(1, first.failed());
        assertFalse(store.contains(article.id()));

        CycleReport second = poller.runCycle();
        assertEquals(1, second.delivered());
        assertEquals(1, store.size());
        assertTrue(store.contains(article.id()));

        CycleReport third = poller.runCycle();
        assertEquals(0, third.queued());
        assertEquals(2, target.calls());
    }

    @Test
    void failureMidBatchDoesNotStopTheRest() {
        collector.returning("wire", List.of(
                article("wire", "Stock slump deepens", "https://news.example.com/a"),
                article("wire", "Market rebound expected", "https://news.example.com/b")
        ));
        target.failWith(new DeliveryException(DeliveryFailureKind.PERMANENT, "message is too long"));
        SourceGroupPoller poller = poller(group(10, SourceConfig.rss("wire", "https://news.example.com/rss")));

        CycleReport report = poller.runCycle();

        assertEquals(1, report.delivered());
        assertEquals(1, report.failed());
        assertEquals(1, store.size());
        assertTrue(store.contains(article("wire", "Market rebound expected", "https://news.example.com/b").id()));
    }

    @Test
    void appliesPerSourceAndPerGroupCapsInSourceOrder() {
        SourceConfig first = withMax(SourceConfig.rss("alpha", "https://alpha.example.com/rss"), 2);
        SourceConfig second = SourceConfig.rss("beta", "https://beta.example.com/rss");
        collector.returning("alpha", List.of(
                article("alpha", "Stock A1", "https://alpha.example.com/1"),
                article("alpha", "Stock A2", "https://alpha.example.com/2"),
                article("alpha", "Stock A3", "https://alpha.example.com/3")
        ));
        collector.returning("beta", List.of(
                article("beta", "Stock B1", "https://beta.example.com/1"),
                article("beta", "Stock B2", "https://beta.example.com/2")
        ));
        SourceGroupPoller poller = poller(group(3, first, second));

        CycleReport report = poller.runCycle();

        assertEquals(5, report.fetched());
        assertEquals(3, report.queued());
        assertEquals(List.of("Stock A1", "Stock A2", "Stock B1"),
                target.sent().stream().map(sent -> sent.text().split("\n")[0].substring(3)).toList());
    }

    @Test
    void skipsIrrelevantStaleSeenAndDuplicateArticles() {
        SourceConfig fresh = new SourceConfig("wire", SourceKind.RSS, List.of("https://news.example.com/rss"), null,
                "STOCK-MARKET", null, true, Duration.ofHours(3), null, null, 0, null);
        SourceConfig mirror = SourceConfig.rss("mirror", "https://mirror.example.com/rss");
        Article seen = article("wire", "Stock split announced", "https://news.example.com/seen");
        Article stale = Article.of("Stock rally fades", "https://news.example.com/old", null,
                clock.instant().minus(Duration.ofHours(5)), null, "STOCK-MARKET", null, "wire");
        Article irrelevant = article("wire", "Celebrity wedding photos", "https://news.example.com/gossip");
        Article wanted = article("wire", "Market breadth improves", "https://news.example.com/new");
        collector.returning("wire", List.of(seen, stale, irrelevant, wanted));
        collector.returning("mirror", List.of(wanted));
        SourceGroupPoller poller = poller(group(10, fresh, mirror));
        store.commit(seen);

        CycleReport report = poller.runCycle();

        assertEquals(1, report.queued());
        assertEquals(1, target.calls());
        assertTrue(target.sent().get(0).text().contains("Market breadth improves"));
    }

    @Test
    void publishesCycleEventsAndEndsSleeping() {
        collector.returning("wire", List.of(article("wire", "Stock futures edge up", "https://news.example.com/f")));
        SourceGroupPoller poller = poller(group(10, SourceConfig.rss("wire", "https://news.example.com/rss")));
        assertEquals(GroupState.IDLE, poller.state());

        poller.runCycle();

        assertEquals(GroupState.SLEEPING, poller.state());
        assertEquals("markets", capture.byType(CycleStarted.class).get(0).groupName());
        CycleCompleted completed = capture.byType(CycleCompleted.class).get(0);
        assertEquals(1, completed.fetched());
        assertEquals(1, completed.delivered());
        assertEquals("@news", target.sent().get(0).destinationId());
    }

    private SourceGroupPoller poller(SourceGroupConfig group) {
        store = new JsonFileDedupStore(dir.resolve("seen.json"), 100, clock);
        RecordingSleeper sleeper = new RecordingSleeper();
        DeliveryWorker worker = new DeliveryWorker(
                target,
                new CircuitBreaker(target.name(), 5, Duration.ofSeconds(60), clock, bus),
                new RetryPolicy(0, Duration.ofSeconds(1), 2.0),
                new DeliveryThrottle(Duration.ZERO, clock, sleeper),
                sleeper,
                bus,
                clock
        );
        return new SourceGroupPoller(
                group,
                collector,
                TestContexts.collectorContext(bus, clock),
                new ArticleFilter(KeywordTaxonomy.financialDefaults()),
                store,
                new MessageFormatter(new NoopTranslator()),
                worker,
                "@news"
        );
    }

    private static SourceGroupConfig group(int maxArticles, SourceConfig... sources) {
        return new SourceGroupConfig("markets", Duration.ofMinutes(3), maxArticles, true, List.of(sources));
    }

    private static SourceConfig withMax(SourceConfig source, int max) {
        return new SourceConfig(source.sourceName(), source.kind(), source.endpoints(), source.alternateEndpoint(),
                source.section(), source.strategies(), source.enforceFreshness(), source.toleranceWindow(),
                source.futureSkew(), source.sectionTolerance(), max, source.selectors());
    }
}
