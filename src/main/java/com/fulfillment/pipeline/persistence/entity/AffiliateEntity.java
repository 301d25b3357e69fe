package com.fulfillment.pipeline.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "affiliates", indexes = {
    @Index(name = "idx_affiliate_user_ref", columnList = "user_ref", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffiliateEntity {

    @Id
    @Column(name = "code", nullable = false, updatable = false, length = 32)
    private String code;

    @Column(name = "user_ref", nullable = false, updatable = false)
    private String userRef;

    @Column(name = "total_sales", nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal totalSales = BigDecimal.ZERO;

    @Column(name = "total_commission", nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal totalCommission = BigDecimal.ZERO;

    @Column(name = "current_tier", nullable = false)
    @Builder.Default
    private int currentTier = 1;

    @Column(name = "bonus_paid", nullable = false)
    private boolean bonusPaid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

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
