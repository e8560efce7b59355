package com.newsrelay.service.delivery;

/**
 * A remote channel that accepts formatted messages.
 */
public interface DeliveryTarget {
    String name();

    /**
     * @param imageUrl optional; {@code null} sends text only
     * @throws DeliveryException classified by {@link DeliveryFailureKind}
     */
    void send(String destinationId, String text, String imageUrl);
}
