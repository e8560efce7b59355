package com.newsrelay.service.health;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.ArticleDelivered;
import com.newsrelay.core.events.DeliveryFailed;
import com.newsrelay.core.events.FetchFailed;
import com.newsrelay.core.events.SourceFetched;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory process health fed from the event bus. Unhealthy when consecutive delivery
 * failures reach {@code unhealthyThreshold} or no fetch has succeeded within
 * {@code staleAfter}.
 */
public class HealthState {
    private final Clock clock;
    private final int unhealthyThreshold;
    private final Duration staleAfter;
    private final Instant startedAt;
    private final Map<String, ErrorStat> errors = new TreeMap<>();

    private int consecutiveFailures;
    private Instant lastSuccessfulFetch;
    private Instant lastSuccessfulDelivery;
    private long deliveredTotal;

    public HealthState(Clock clock, int unhealthyThreshold, Duration staleAfter) {
        this.clock = clock;
        this.unhealthyThreshold = unhealthyThreshold;
        this.staleAfter = staleAfter;
        this.startedAt = clock.instant();
    }

    public HealthState(EventBus eventBus, Clock clock, int unhealthyThreshold, Duration staleAfter) {
        this(clock, unhealthyThreshold, staleAfter);
        eventBus.subscribe(SourceFetched.class, event -> recordFetchSuccess(event.timestamp()));
        eventBus.subscribe(FetchFailed.class, event -> recordError("fetch:" + event.failureKind(), event.timestamp()));
        eventBus.subscribe(ArticleDelivered.class, event -> recordDeliverySuccess(event.timestamp()));
        eventBus.subscribe(DeliveryFailed.class, event -> recordDeliveryFailure(event.failureKind(), event.timestamp()));
        eventBus.subscribe(AlertRaised.class, event -> recordError("alert:" + event.category(), event.timestamp()));
    }

    public synchronized void recordFetchSuccess(Instant at) {
        lastSuccessfulFetch = at;
    }

    public synchronized void recordDeliverySuccess(Instant at) {
        lastSuccessfulDelivery = at;
        consecutiveFailures = 0;
        deliveredTotal++;
    }

    public synchronized void recordDeliveryFailure(String kind, Instant at) {
        consecutiveFailures++;
        recordError("delivery:" + kind, at);
    }

    public synchronized void recordError(String kind, Instant at) {
        errors.compute(kind, (ignored, current) -> current == null ? new ErrorStat(1, at) : new ErrorStat(current.count() + 1, at));
    }

    public synchronized boolean isHealthy() {
        if (consecutiveFailures >= unhealthyThreshold) {
            return false;
        }
        Instant reference = lastSuccessfulFetch == null ? startedAt : lastSuccessfulFetch;
        return !clock.instant().isAfter(reference.plus(staleAfter));
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Map<String, Object> report() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("status", isHealthy() ? "healthy" : "unhealthy");
        report.put("startedAt", startedAt.toString());
        report.put("uptimeSeconds", Duration.between(startedAt, clock.instant()).toSeconds());
        report.put("consecutiveFailures", consecutiveFailures);
        report.put("lastSuccessfulFetch", lastSuccessfulFetch == null ? null : lastSuccessfulFetch.toString());
        report.put("lastSuccessfulDelivery", lastSuccessfulDelivery == null ? null : lastSuccessfulDelivery.toString());
        report.put("deliveredTotal", deliveredTotal);
        Map<String, Object> errorView = new LinkedHashMap<>();
        errors.forEach((kind, stat) -> errorView.put(kind, Map.of("count", stat.count(), "lastSeen", stat.lastSeen().toString())));
        report.put("errors", errorView);
        return report;
    }

    private record ErrorStat(long count, Instant lastSeen) {
    }
}
