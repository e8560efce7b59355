package com.newsrelay.core.util;

import java.time.Duration;

/**
 * Blocking pause used by backoff and throttling. Tests substitute a recording sleeper.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            long millis = duration.toMillis();
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
