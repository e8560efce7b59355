package com.newsrelay.service.delivery;

import java.time.Duration;

public class DeliveryException extends RuntimeException {
    private final DeliveryFailureKind kind;
    private final Duration retryAfter;

    public DeliveryException(DeliveryFailureKind kind, String message) {
        this(kind, message, null, null);
    }

    public DeliveryException(DeliveryFailureKind kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public static DeliveryException rateLimited(String message, Duration retryAfter) {
        return new DeliveryException(DeliveryFailureKind.RATE_LIMITED, message, retryAfter, null);
    }

    public DeliveryFailureKind kind() {
        return kind;
    }

    /**
     * Wait requested by the remote side, or {@code null}.
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
