package com.fulfillment.pipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Normalized answer of the payment provider to a refund request.
 */
@Value
@Builder
public class RefundResult {

    String idempotencyKey;
    String paymentReference;

    /** Provider's refund transaction ID. */
    String providerRefundId;

    RefundStatus status;
    BigDecimal amount;
    String currencyCode;
    String failureCode;
    String message;
    Instant timestamp;

    public boolean isSuccess() {
        return status == RefundStatus.SUCCESS;
    }
}
