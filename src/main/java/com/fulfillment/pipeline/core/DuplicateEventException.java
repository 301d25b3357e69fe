package com.fulfillment.pipeline.core;

import lombok.Getter;

/**
 * Raised inside the ingress transaction when the event was already admitted, so the transaction
 * rolls back without touching the order.
 */
@Getter
public class DuplicateEventException extends RuntimeException {

    private final String orderId;
    private final String eventId;

    public DuplicateEventException(String orderId, String eventId) {
        super("Event already processed: orderId=" + orderId + ", eventId=" + eventId);
        this.orderId = orderId;
        this.eventId = eventId;
    }
}
