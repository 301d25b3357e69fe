package com.fulfillment.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Body of the payment provider's webhook, parsed only after the signature over the raw bytes has
 * been verified.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentWebhookEvent {

    public static final String STATUS_PAID = "paid";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_CANCELLED = "cancelled";

    @JsonProperty("order_id")
    private String orderId;

    /** paid, failed, cancelled; anything else is ignored. */
    @JsonProperty("status")
    private String status;

    @JsonProperty("payment_reference")
    @JsonAlias("payment_id")
    private String paymentReference;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("currency")
    private String currency;

    /** Provider idempotency key; optional on some deliveries. */
    @JsonProperty("event_id")
    @JsonAlias("idempotency_key")
    private String eventId;

    /** Epoch seconds when the provider emitted the event. */
    @JsonProperty("timestamp")
    private Long timestamp;

    @JsonProperty("error_message")
    private String errorMessage;
}
