package com.newsrelay.core.model;

import java.time.Duration;
import java.util.List;

public record SourceGroupConfig(
        String name,
        Duration interval,
        int maxArticlesPerCycle,
        Boolean enabled,
        List<SourceConfig> sources
) {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(3);

    public SourceGroupConfig {
        interval = interval == null ? DEFAULT_INTERVAL : interval;
        maxArticlesPerCycle = maxArticlesPerCycle <= 0 ? 8 : maxArticlesPerCycle;
        enabled = enabled == null || enabled;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
