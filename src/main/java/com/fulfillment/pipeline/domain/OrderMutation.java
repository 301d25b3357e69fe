package com.fulfillment.pipeline.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Field changes written atomically together with a status transition. Null fields are left
 * untouched.
 */
@Value
@Builder
public class OrderMutation {

    public static final OrderMutation NONE = OrderMutation.builder().build();

    String paymentReference;
    String paymentMethod;
    String enrichmentData;
    String generatedContent;
    String errorMessage;
    RefundState refundState;
    /** Provider event that caused the transition, recorded as the order's last processed event. */
    String processedEventId;
}
