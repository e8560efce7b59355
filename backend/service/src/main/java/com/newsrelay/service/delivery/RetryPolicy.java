package com.newsrelay.service.delivery;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay before retry {@code attempt} (0-based) is {@code baseDelay * factor^attempt}; a
 * remote {@code retryAfter} raises it to {@code max(computed, retryAfter)}.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, double factor) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Objects.requireNonNull(baseDelay, "baseDelay is required");
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be >= 1");
        }
    }

    public Duration delayFor(int attempt, Duration retryAfter) {
        long computedMillis = Math.round(baseDelay.toMillis() * Math.pow(factor, attempt));
        Duration computed = Duration.ofMillis(computedMillis);
        if (retryAfter != null && retryAfter.compareTo(computed) > 0) {
            return retryAfter;
        }
        return computed;
    }
}
