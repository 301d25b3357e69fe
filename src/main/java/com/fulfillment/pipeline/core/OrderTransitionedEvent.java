package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.OrderStatus;
import lombok.Value;

/**
 * Spring application event for an applied transition; consumed after commit.
 */
@Value
public class OrderTransitionedEvent {
    LifecycleEvent event;
    OrderStatus from;
    OrderSnapshot order;
}
