package com.fulfillment.pipeline.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request to return a captured payment. Always a full refund of the order amount.
 */
@Value
@Builder
public class RefundRequest {

    /** Idempotency key for this refund, derived from the order id so it is stable across attempts. */
    @NotBlank
    String idempotencyKey;

    @NotBlank
    String orderId;

    /** Provider-assigned reference of the captured payment. */
    @NotBlank
    String paymentReference;

    @DecimalMin("0.01")
    BigDecimal amount;

    @NotBlank
    String currencyCode;

    /** Reason for refund, for audit purposes. */
    String reason;
}
