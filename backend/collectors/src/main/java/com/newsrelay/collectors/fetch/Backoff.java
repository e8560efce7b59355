package com.newsrelay.collectors.fetch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential delay with ±50% jitter: {@code min(cap, base * 2^attempt) * (0.5 + r)} with
 * {@code r} in [0, 1).
 */
public final class Backoff {
    private final Duration base;
    private final Duration cap;
    private final DoubleSupplier random;

    public Backoff(Duration base, Duration cap) {
        this(base, cap, () -> ThreadLocalRandom.current().nextDouble());
    }

    public Backoff(Duration base, Duration cap, DoubleSupplier random) {
        this.base = Objects.requireNonNull(base, "base is required");
        this.cap = Objects.requireNonNull(cap, "cap is required");
        this.random = Objects.requireNonNull(random, "random is required");
    }

    public static Backoff none() {
        return new Backoff(Duration.ZERO, Duration.ZERO, () -> 0.5);
    }

    public Duration delayFor(int attempt) {
        double exponential = base.toMillis() * Math.pow(2, Math.max(0, attempt));
        double capped = Math.min(exponential, cap.toMillis());
        return Duration.ofMillis(Math.round(capped * (0.5 + random.getAsDouble())));
    }
}
