package com.newsrelay.service.runtime;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.api.CollectorResult;
import com.newsrelay.collectors.filter.ArticleFilter;
import com.newsrelay.collectors.source.SourceCollector;
import com.newsrelay.core.events.CycleCompleted;
import com.newsrelay.core.events.CycleStarted;
import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceGroupConfig;
import com.newsrelay.service.delivery.DeliveryOutcome;
import com.newsrelay.service.delivery.DeliveryPayload;
import com.newsrelay.service.delivery.DeliveryWorker;
import com.newsrelay.service.format.FormattedMessage;
import com.newsrelay.service.format.MessageFormatter;
import com.newsrelay.service.store.DedupStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Runs the poll cycle of one source group: fetch every source, keep the fresh, relevant
 * and unseen articles in source order, deliver them one by one and commit each one that
 * was delivered. A failed delivery is left uncommitted so the next cycle picks it up.
 */
public class SourceGroupPoller {
    private static final Logger LOGGER = Logger.getLogger(SourceGroupPoller.class.getName());

    private final SourceGroupConfig group;
    private final SourceCollector collector;
    private final CollectorContext context;
    private final ArticleFilter filter;
    private final DedupStore store;
    private final MessageFormatter formatter;
    private final DeliveryWorker worker;
    private final String destinationId;
    private volatile GroupState state = GroupState.IDLE;

    public SourceGroupPoller(
            SourceGroupConfig group,
            SourceCollector collector,
            CollectorContext context,
            ArticleFilter filter,
            DedupStore store,
            MessageFormatter formatter,
            DeliveryWorker worker,
            String destinationId
    ) {
        this.group = Objects.requireNonNull(group, "group is required");
        this.collector = Objects.requireNonNull(collector, "collector is required");
        this.context = Objects.requireNonNull(context, "context is required");
        this.filter = Objects.requireNonNull(filter, "filter is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.formatter = Objects.requireNonNull(formatter, "formatter is required");
        this.worker = Objects.requireNonNull(worker, "worker is required");
        this.destinationId = Objects.requireNonNull(destinationId, "destinationId is required");
    }

    public CycleReport runCycle() {
        Instant started = context.clock().instant();
        context.eventBus().publish(new CycleStarted(started, group.name()));
        try {
            state = GroupState.FETCHING;
            List<CollectorResult> results = new ArrayList<>();
            for (SourceConfig source : group.sources()) {
                results.add(collector.collect(source, context));
            }
            int fetched = results.stream().mapToInt(result -> result.articles().size()).sum();

            state = GroupState.FILTERING;
            List<Article> queue = select(results);

            state = GroupState.DELIVERING;
            int delivered = 0;
            int failed = 0;
            for (Article article : queue) {
                if (Thread.currentThread().isInterrupted()) {
                    LOGGER.info("Group " + group.name() + " interrupted; leaving " + (queue.size() - delivered - failed)
                            + " article(s) for the next cycle");
                    break;
                }
                if (deliver(article)) {
                    delivered++;
                } else {
                    failed++;
                }
            }

            Instant finished = context.clock().instant();
            Duration duration = Duration.between(started, finished);
            context.eventBus().publish(new CycleCompleted(
                    finished, group.name(), fetched, queue.size(), delivered, failed, duration.toMillis()));
            LOGGER.info("Group " + group.name() + " cycle done: fetched=" + fetched + " queued=" + queue.size()
                    + " delivered=" + delivered + " failed=" + failed);
            return new CycleReport(group.name(), fetched, queue.size(), delivered, failed, duration, null);
        } finally {
            state = GroupState.SLEEPING;
        }
    }

    private List<Article> select(List<CollectorResult> results) {
        Instant now = context.clock().instant();
        Set<String> queuedIds = new HashSet<>();
        List<Article> queue = new ArrayList<>();
        for (int i = 0; i < results.size() && queue.size() < group.maxArticlesPerCycle(); i++) {
            SourceConfig source = group.sources().get(i);
            int takenFromSource = 0;
            for (Article article : results.get(i).articles()) {
                if (queue.size() >= group.maxArticlesPerCycle() || takenFromSource >= source.maxArticlesPerCycle()) {
                    break;
                }
                if (queuedIds.contains(article.id()) || store.contains(article.id())) {
                    continue;
                }
                if (!filter.keep(article, source.freshnessPolicy(), now)) {
                    continue;
                }
                queuedIds.add(article.id());
                queue.add(article);
                takenFromSource++;
            }
        }
        return queue;
    }

    private boolean deliver(Article article) {
        FormattedMessage message = formatter.format(article);
        DeliveryOutcome outcome = worker.deliver(new DeliveryPayload(
                article.id(), article.sourceName(), destinationId, message.text(), message.imageUrl()));
        if (!outcome.ok()) {
            LOGGER.warning("Delivery of " + article.id() + " from " + article.sourceName() + " failed ("
                    + outcome.failureKind() + "): " + outcome.message());
            return false;
        }
        store.commit(article);
        return true;
    }

    public String groupName() {
        return group.name();
    }

    public Duration interval() {
        return group.interval();
    }

    public boolean enabled() {
        return group.enabled();
    }

    public GroupState state() {
        return state;
    }
}
