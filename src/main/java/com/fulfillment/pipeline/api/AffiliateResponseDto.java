package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.persistence.entity.AffiliateEntity;
import com.fulfillment.pipeline.persistence.entity.AffiliateLedgerEntryEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Affiliate totals with the ledger, newest entry first.
 */
@Value
@Builder
public class AffiliateResponseDto {

    String code;
    String userRef;
    BigDecimal totalSales;
    BigDecimal totalCommission;
    int currentTier;
    boolean bonusPaid;
    List<LedgerEntry> ledger;

    @Value
    @Builder
    public static class LedgerEntry {
        String orderId;
        BigDecimal orderAmount;
        BigDecimal commissionRate;
        BigDecimal commissionAmount;
        BigDecimal bonusAmount;
        int tier;
        Instant createdAt;
    }

    public static AffiliateResponseDto from(AffiliateEntity affiliate, List<AffiliateLedgerEntryEntity> entries) {
        return AffiliateResponseDto.builder()
                .code(affiliate.getCode())
                .userRef(affiliate.getUserRef())
                .totalSales(affiliate.getTotalSales())
                .totalCommission(affiliate.getTotalCommission())
                .currentTier(affiliate.getCurrentTier())
                .bonusPaid(affiliate.isBonusPaid())
                .ledger(entries.stream()
                        .map(e -> LedgerEntry.builder()
                                .orderId(e.getOrderId())
                                .orderAmount(e.getOrderAmount())
                                .commissionRate(e.getCommissionRate())
                                .commissionAmount(e.getCommissionAmount())
                                .bonusAmount(e.getBonusAmount())
                                .tier(e.getTier())
                                .createdAt(e.getCreatedAt())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
