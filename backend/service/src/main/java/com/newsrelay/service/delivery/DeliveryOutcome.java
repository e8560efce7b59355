package com.newsrelay.service.delivery;

public record DeliveryOutcome(boolean ok, DeliveryFailureKind failureKind, String message, int attempts) {
    public static DeliveryOutcome delivered(int attempts) {
        return new DeliveryOutcome(true, null, null, attempts);
    }

    public static DeliveryOutcome failure(DeliveryFailureKind kind, String message, int attempts) {
        return new DeliveryOutcome(false, kind, message, attempts);
    }
}
