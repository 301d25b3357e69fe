package com.fulfillment.pipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What the front-end needs to build a checkout link for a new order. The signature is an HMAC over
 * {@code orderId|amount|currency} with the shared provider secret.
 */
@Value
@Builder
public class PaymentInitiation {

    String orderId;
    /** pending_payment, or paid for free products that need no checkout. */
    OrderStatus status;
    BigDecimal amount;
    String currency;
    String signature;
}
