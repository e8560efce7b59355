package com.newsrelay.service.delivery;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.CircuitStateChanged;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * Per-target breaker. {@code failureThreshold} consecutive failures open it; once
 * {@code coolDown} has passed a single trial request is let through in HALF_OPEN, and its
 * result closes or re-opens the breaker.
 */
public class CircuitBreaker {
    private static final Logger LOGGER = Logger.getLogger(CircuitBreaker.class.getName());

    private final String target;
    private final int failureThreshold;
    private final Duration coolDown;
    private final Clock clock;
    private final EventBus eventBus;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private boolean trialInFlight;

    public CircuitBreaker(String target, int failureThreshold, Duration coolDown, Clock clock, EventBus eventBus) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.target = target;
        this.failureThreshold = failureThreshold;
        this.coolDown = coolDown;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public synchronized boolean allowRequest() {
        if (state == CircuitState.CLOSED) {
            return true;
        }
        if (state == CircuitState.OPEN) {
            if (lastFailureAt != null && clock.instant().isBefore(lastFailureAt.plus(coolDown))) {
                return false;
            }
            transition(CircuitState.HALF_OPEN);
        }
        if (trialInFlight) {
            return false;
        }
        trialInFlight = true;
        return true;
    }

    public synchronized void recordSuccess() {
        trialInFlight = false;
        failureCount = 0;
        if (state != CircuitState.CLOSED) {
            transition(CircuitState.CLOSED);
        }
    }

    public synchronized void recordFailure() {
        trialInFlight = false;
        failureCount++;
        lastFailureAt = clock.instant();
        if (state == CircuitState.HALF_OPEN || (state == CircuitState.CLOSED && failureCount >= failureThreshold)) {
            transition(CircuitState.OPEN);
        }
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(target, state, failureCount, lastFailureAt);
    }

    public String target() {
        return target;
    }

    private void transition(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (next == CircuitState.OPEN) {
            LOGGER.warning("Circuit for " + target + " opened after " + failureCount + " failures");
        } else {
            LOGGER.info("Circuit for " + target + " " + previous + " -> " + next);
        }
        eventBus.publish(new CircuitStateChanged(clock.instant(), target, previous.name(), next.name(), failureCount));
    }

    public record Snapshot(String target, CircuitState state, int failureCount, Instant lastFailureAt) {
    }
}
