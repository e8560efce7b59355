package com.newsrelay.service.delivery;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.ArticleDelivered;
import com.newsrelay.core.events.DeliveryFailed;
import com.newsrelay.core.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends one payload through the circuit breaker, the global throttle and the retry
 * policy. Only TRANSIENT and RATE_LIMITED failures are retried. A {@code deliver} call
 * that ends in failure counts once against the breaker, however many attempts it made.
 */
public class DeliveryWorker {
    private static final Logger LOGGER = Logger.getLogger(DeliveryWorker.class.getName());

    private final DeliveryTarget target;
    private final CircuitBreaker breaker;
    private final RetryPolicy retryPolicy;
    private final DeliveryThrottle throttle;
    private final Sleeper sleeper;
    private final EventBus eventBus;
    private final Clock clock;

    public DeliveryWorker(
            DeliveryTarget target,
            CircuitBreaker breaker,
            RetryPolicy retryPolicy,
            DeliveryThrottle throttle,
            Sleeper sleeper,
            EventBus eventBus,
            Clock clock
    ) {
        this.target = target;
        this.breaker = breaker;
        this.retryPolicy = retryPolicy;
        this.throttle = throttle;
        this.sleeper = sleeper;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public DeliveryOutcome deliver(DeliveryPayload payload) {
        if (!breaker.allowRequest()) {
            return failed(payload, DeliveryFailureKind.CIRCUIT_OPEN, "circuit open for " + target.name(), 0);
        }

        int attempts = 0;
        DeliveryException last = null;
        try {
            for (int attempt = 0; attempt <= retryPolicy.maxRetries(); attempt++) {
                throttle.awaitTurn();
                attempts++;
                try {
                    target.send(payload.destinationId(), payload.text(), payload.imageUrl());
                    breaker.recordSuccess();
                    eventBus.publish(new ArticleDelivered(clock.instant(), payload.articleId(), payload.sourceName(), attempts));
                    return DeliveryOutcome.delivered(attempts);
                } catch (DeliveryException e) {
                    last = e;
                    if (!e.kind().retryable()) {
                        LOGGER.severe("Non-recoverable delivery failure for article " + payload.articleId()
                                + " via " + target.name() + ": " + e.getMessage());
                        break;
                    }
                    if (attempt == retryPolicy.maxRetries()) {
                        break;
                    }
                    Duration delay = retryPolicy.delayFor(attempt, e.retryAfter());
                    LOGGER.warning("Delivery attempt " + attempts + " failed (" + e.kind() + "): " + e.getMessage()
                            + "; retrying in " + delay.toMillis() + "ms");
                    sleeper.sleep(delay);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.log(Level.FINE, "Delivery interrupted for article " + payload.articleId(), e);
            breaker.recordFailure();
            return failed(payload, DeliveryFailureKind.TRANSIENT, "interrupted", attempts);
        }

        breaker.recordFailure();
        DeliveryFailureKind kind = last == null ? DeliveryFailureKind.TRANSIENT : last.kind();
        String message = last == null ? "no attempt made" : last.getMessage();
        return failed(payload, kind, message, attempts);
    }

    public CircuitBreaker breaker() {
        return breaker;
    }

    private DeliveryOutcome failed(DeliveryPayload payload, DeliveryFailureKind kind, String message, int attempts) {
        eventBus.publish(new DeliveryFailed(clock.instant(), payload.articleId(), kind.name(), message, attempts));
        return DeliveryOutcome.failure(kind, message, attempts);
    }
}
