package com.newsrelay.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record SourceConfig(
        String sourceName,
        SourceKind kind,
        List<String> endpoints,
        String alternateEndpoint,
        String section,
        List<String> strategies,
        boolean enforceFreshness,
        Duration toleranceWindow,
        Duration futureSkew,
        Map<String, Duration> sectionTolerance,
        int maxArticlesPerCycle,
        HtmlSelectors selectors
) {
    public static final String AUTO_SECTION = "AUTO";
    public static final int DEFAULT_MAX_ARTICLES = 10;

    public SourceConfig {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        section = section == null || section.isBlank()
                ? (sourceName == null ? "NEWS" : sourceName.toUpperCase(Locale.ROOT))
                : section;
        strategies = strategies == null || strategies.isEmpty() ? defaultStrategies(kind) : List.copyOf(strategies);
        sectionTolerance = sectionTolerance == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sectionTolerance));
        maxArticlesPerCycle = maxArticlesPerCycle <= 0 ? DEFAULT_MAX_ARTICLES : maxArticlesPerCycle;
        selectors = selectors == null ? HtmlSelectors.defaults() : selectors;
    }

    public static SourceConfig rss(String sourceName, String url) {
        return new SourceConfig(sourceName, SourceKind.RSS, List.of(url), null, null, null,
                false, null, null, null, 0, null);
    }

    public static SourceConfig html(String sourceName, String url) {
        return new SourceConfig(sourceName, SourceKind.HTML, List.of(url), null, null, null,
                false, null, null, null, 0, null);
    }

    public FreshnessPolicy freshnessPolicy() {
        return new FreshnessPolicy(enforceFreshness, toleranceWindow, futureSkew, sectionTolerance);
    }

    public boolean autoSection() {
        return AUTO_SECTION.equalsIgnoreCase(section);
    }

    private static List<String> defaultStrategies(SourceKind kind) {
        if (kind == SourceKind.HTML) {
            return List.of("direct", "mobile", "crawler");
        }
        return List.of("feed", "direct");
    }
}
