package com.fulfillment.pipeline.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Transition table of the order state machine. Each event names the exact source statuses it
 * may be applied from and the status it moves the order to.
 */
public enum LifecycleEvent {

    PAYMENT_CONFIRMED(EnumSet.of(OrderStatus.PENDING_PAYMENT), OrderStatus.PAID),
    PAYMENT_FAILED(EnumSet.of(OrderStatus.PENDING_PAYMENT), OrderStatus.FAILED),
    ENRICHMENT_DONE(EnumSet.of(OrderStatus.PAID), OrderStatus.GENERATING),
    GENERATION_DONE(EnumSet.of(OrderStatus.GENERATING), OrderStatus.COMPLETED),
    PIPELINE_ERROR(EnumSet.of(OrderStatus.PAID, OrderStatus.GENERATING), OrderStatus.FAILED),
    /** Only legal for a failed order that had captured money (payment reference present). */
    REFUND_DONE(EnumSet.of(OrderStatus.FAILED), OrderStatus.REFUNDED);

    private final Set<OrderStatus> allowedSources;
    private final OrderStatus target;

    LifecycleEvent(Set<OrderStatus> allowedSources, OrderStatus target) {
        this.allowedSources = Collections.unmodifiableSet(allowedSources);
        this.target = target;
    }

    public Set<OrderStatus> getAllowedSources() {
        return allowedSources;
    }

    public OrderStatus getTarget() {
        return target;
    }

    public boolean isAllowedFrom(OrderStatus current) {
        return allowedSources.contains(current);
    }
}
