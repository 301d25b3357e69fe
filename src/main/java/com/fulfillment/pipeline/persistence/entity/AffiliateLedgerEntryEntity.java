package com.fulfillment.pipeline.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only commission credit. The unique order id makes a second credit for the same order fail
 * at the database.
 */
@Entity
@Table(name = "affiliate_ledger", uniqueConstraints = {
    @UniqueConstraint(name = "uk_ledger_order_id", columnNames = "order_id")
}, indexes = {
    @Index(name = "idx_ledger_affiliate_code", columnList = "affiliate_code")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffiliateLedgerEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "affiliate_code", nullable = false, updatable = false, length = 32)
    private String affiliateCode;

    @Column(name = "order_id", nullable = false, updatable = false, length = 64)
    private String orderId;

    @Column(name = "order_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal orderAmount;

    @Column(name = "commission_rate", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal commissionRate;

    @Column(name = "commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "bonus_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal bonusAmount;

    @Column(name = "tier", nullable = false, updatable = false)
    private int tier;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
