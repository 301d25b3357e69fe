package com.fulfillment.pipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable, point-in-time read of an order. Callers outside the store only ever see snapshots and
 * must re-read before acting after any suspension point.
 */
@Value
@Builder(toBuilder = true)
public class OrderSnapshot {

    String orderId;
    String userRef;
    ProductKind productKind;
    boolean requiresEnrichment;
    OrderStatus status;
    BigDecimal amount;
    String currency;
    Map<String, Object> userInput;
    String paymentReference;
    String paymentMethod;
    String enrichmentData;
    String generatedContent;
    String affiliateCode;
    String lastProcessedEventId;
    String errorMessage;
    RefundState refundState;
    Long version;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;

    /** Money was captured for this order and would have to be returned on failure. */
    public boolean hasCapturedPayment() {
        return paymentReference != null && amount != null && amount.signum() > 0;
    }

    public boolean hasEnrichmentData() {
        return enrichmentData != null;
    }

    public boolean hasGeneratedContent() {
        return generatedContent != null;
    }

    public boolean hasAffiliate() {
        return affiliateCode != null && !affiliateCode.isBlank();
    }
}
