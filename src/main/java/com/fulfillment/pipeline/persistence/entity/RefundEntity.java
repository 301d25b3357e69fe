package com.fulfillment.pipeline.persistence.entity;

import com.fulfillment.pipeline.domain.RefundStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Compensation record for an order. Written as PENDING before the provider is called, so a crash
 * between the call and the outcome leaves evidence instead of a silent gap.
 */
@Entity
@Table(name = "refunds", indexes = {
    @Index(name = "idx_refund_order_id", columnList = "order_id", unique = true),
    @Index(name = "idx_refund_status", columnList = "status"),
    @Index(name = "idx_refund_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefundEntity {

    @Id
    @Column(name = "refund_idempotency_key", unique = true, nullable = false)
    private String refundIdempotencyKey;

    @Column(name = "order_id", nullable = false, updatable = false, length = 64)
    private String orderId;

    @Column(name = "payment_reference", nullable = false)
    private String paymentReference;

    @Column(name = "provider_refund_id")
    private String providerRefundId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RefundStatus status;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency_code", nullable = false, length = 3)
    private String currencyCode;

    @Column(name = "failure_code")
    private String failureCode;

    @Column(name = "failure_message", length = 1000)
    private String failureMessage;

    @Column(name = "reason", length = 500)
    private String reason;

    /** Set when an operator resolved the refund outside the system. */
    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
