package com.fulfillment.pipeline.domain;

import lombok.Value;

/**
 * Result of asking the state machine to apply an event. A stale outcome is not an error: the event
 * no longer applies to the order's current status and nothing was written.
 */
@Value
public class TransitionOutcome {

    boolean applied;
    LifecycleEvent event;
    OrderStatus previousStatus;
    OrderSnapshot order;

    public static TransitionOutcome applied(LifecycleEvent event, OrderStatus previousStatus, OrderSnapshot order) {
        return new TransitionOutcome(true, event, previousStatus, order);
    }

    public static TransitionOutcome stale(LifecycleEvent event, OrderSnapshot current) {
        return new TransitionOutcome(false, event, current.getStatus(), current);
    }

    public boolean isStale() {
        return !applied;
    }
}
