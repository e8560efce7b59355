package com.newsrelay.service.delivery;

import com.newsrelay.core.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Global minimum spacing between outbound deliveries, shared by every group.
 */
public class DeliveryThrottle {
    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;
    private Instant lastDelivery;

    public DeliveryThrottle(Duration minInterval, Clock clock, Sleeper sleeper) {
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public synchronized void awaitTurn() throws InterruptedException {
        if (lastDelivery != null) {
            Duration wait = Duration.between(clock.instant(), lastDelivery.plus(minInterval));
            if (!wait.isNegative() && !wait.isZero()) {
                sleeper.sleep(wait);
            }
        }
        lastDelivery = clock.instant();
    }
}
