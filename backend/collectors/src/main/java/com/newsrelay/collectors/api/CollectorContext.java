package com.newsrelay.collectors.api;

import com.newsrelay.collectors.fetch.FetchChain;
import com.newsrelay.collectors.fetch.FetchStrategies;
import com.newsrelay.core.bus.EventBus;

import java.time.Clock;
import java.util.Objects;

public record CollectorContext(
        FetchChain fetchChain,
        FetchStrategies strategies,
        EventBus eventBus,
        Clock clock
) {
    public CollectorContext {
        Objects.requireNonNull(fetchChain, "fetchChain is required");
        Objects.requireNonNull(strategies, "strategies is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
