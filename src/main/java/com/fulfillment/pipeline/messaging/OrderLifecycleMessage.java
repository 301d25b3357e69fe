package com.fulfillment.pipeline.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Message published to Kafka for every applied order transition and for conditions that need an
 * operator. Keyed by order id so consumers see one order's history in order.
 */
@Value
@Builder
@Jacksonized
public class OrderLifecycleMessage {

    public static final String OPERATOR_ALERT = "OPERATOR_ALERT";

    String messageId;
    String orderId;
    /** Lifecycle event name, or OPERATOR_ALERT */
    String eventType;
    String fromStatus;
    String toStatus;
    String productKind;
    BigDecimal amount;
    String currency;
    String refundState;
    String message;
    Instant timestamp;
}
