package com.newsrelay.service.delivery;

public enum DeliveryFailureKind {
    TRANSIENT,
    RATE_LIMITED,
    PERMANENT,
    CIRCUIT_OPEN;

    public boolean retryable() {
        return this == TRANSIENT || this == RATE_LIMITED;
    }
}
