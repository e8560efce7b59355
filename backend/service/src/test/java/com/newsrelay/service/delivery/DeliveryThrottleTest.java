package com.newsrelay.service.delivery;

import com.newsrelay.service.support.MutableClock;
import com.newsrelay.service.support.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryThrottleTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final DeliveryThrottle throttle = new DeliveryThrottle(Duration.ofSeconds(6), clock, sleeper);

    @Test
    void firstDeliveryDoesNotWait() throws Exception {
        throttle.awaitTurn();
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void waitsOnlyForTheRemainderOfTheInterval() throws Exception {
        throttle.awaitTurn();
        clock.advance(Duration.ofSeconds(2));
        throttle.awaitTurn();
        clock.advance(Duration.ofSeconds(10));
        throttle.awaitTurn();

        assertEquals(List.of(Duration.ofSeconds(4)), sleeper.sleeps());
    }
}
