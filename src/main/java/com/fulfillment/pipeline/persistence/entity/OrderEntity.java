package com.fulfillment.pipeline.persistence.entity;

import com.fulfillment.pipeline.domain.OrderStatus;
import com.fulfillment.pipeline.domain.ProductKind;
import com.fulfillment.pipeline.domain.RefundState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persistent order record. Every status change goes through a versioned write so that concurrent
 * writers on the same order detect each other.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_order_status_updated", columnList = "status, updated_at"),
    @Index(name = "idx_order_user_ref", columnList = "user_ref"),
    @Index(name = "idx_order_refund_state", columnList = "refund_state"),
    @Index(name = "idx_order_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEntity {

    @Id
    @Column(name = "order_id", nullable = false, updatable = false, length = 64)
    private String orderId;

    @Column(name = "user_ref", nullable = false, updatable = false)
    private String userRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_kind", nullable = false, updatable = false, length = 40)
    private ProductKind productKind;

    @Column(name = "requires_enrichment", nullable = false, updatable = false)
    private boolean requiresEnrichment;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private OrderStatus status;

    @Column(name = "amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency_code", nullable = false, updatable = false, length = 3)
    private String currencyCode;

    /** JSON object with the user's answers collected by the front-end. */
    @Column(name = "user_input", length = 8000)
    private String userInput;

    @Column(name = "payment_reference", length = 255)
    private String paymentReference;

    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @Column(name = "enrichment_data", length = 65535)
    private String enrichmentData;

    @Column(name = "generated_content", length = 65535)
    private String generatedContent;

    @Column(name = "affiliate_code", updatable = false, length = 32)
    private String affiliateCode;

    @Column(name = "last_processed_event_id")
    private String lastProcessedEventId;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "refund_state", nullable = false, length = 20)
    @Builder.Default
    private RefundState refundState = RefundState.NONE;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
