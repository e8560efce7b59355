package com.newsrelay.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Publish-time window for one source. {@code sectionTolerance} keys are matched as
 * case-insensitive substrings of the article section; the first match wins over
 * {@code toleranceWindow}.
 */
public record FreshnessPolicy(
        boolean enforceFreshness,
        Duration toleranceWindow,
        Duration futureSkew,
        Map<String, Duration> sectionTolerance
) {
    public static final Duration DEFAULT_TOLERANCE = Duration.ofHours(3);
    public static final Duration DEFAULT_FUTURE_SKEW = Duration.ofMinutes(30);

    public FreshnessPolicy {
        toleranceWindow = toleranceWindow == null ? DEFAULT_TOLERANCE : toleranceWindow;
        futureSkew = futureSkew == null ? DEFAULT_FUTURE_SKEW : futureSkew;
        sectionTolerance = sectionTolerance == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sectionTolerance));
    }

    public static FreshnessPolicy disabled() {
        return new FreshnessPolicy(false, DEFAULT_TOLERANCE, DEFAULT_FUTURE_SKEW, Map.of());
    }

    public Duration toleranceFor(String section) {
        if (section == null || sectionTolerance.isEmpty()) {
            return toleranceWindow;
        }
        String lowered = section.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Duration> entry : sectionTolerance.entrySet()) {
            if (lowered.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                return entry.getValue();
            }
        }
        return toleranceWindow;
    }
}
