package com.fulfillment.pipeline.domain;

import java.util.Arrays;

/**
 * Lifecycle states of a fulfillment order. The only legal moves between them are the
 * ones declared by {@link LifecycleEvent}.
 */
public enum OrderStatus {
    /** Created, waiting for the provider's payment outcome. */
    PENDING_PAYMENT("pending_payment"),
    /** Payment captured; fulfillment has been (or will be) dispatched. */
    PAID("paid"),
    /** Enrichment finished or skipped; content generation in progress. */
    GENERATING("generating"),
    /** Content generated and stored. Terminal. */
    COMPLETED("completed"),
    /** Payment failed, or the pipeline gave up. Terminal unless a refund follows. */
    FAILED("failed"),
    /** Captured money returned to the customer. Terminal. */
    REFUNDED("refunded");

    private final String wireValue;

    OrderStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == REFUNDED;
    }

    /** Statuses in which an unfinished pipeline run may exist. */
    public boolean isInFlight() {
        return this == PAID || this == GENERATING;
    }

    public static OrderStatus fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }
}
