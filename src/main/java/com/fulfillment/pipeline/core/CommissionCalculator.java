package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.CommissionQuote;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Tiered affiliate commission. The rate is chosen by the affiliate's cumulative sales before the
 * order; the one-time bonus is paid on the order that first lifts cumulative sales to the threshold.
 */
@Component
public class CommissionCalculator {

    static final BigDecimal BONUS_THRESHOLD = new BigDecimal("8000");
    static final BigDecimal BONUS_AMOUNT = new BigDecimal("500.00");

    private static final List<Tier> TIERS = List.of(
            new Tier(BigDecimal.ZERO, new BigDecimal("1000"), new BigDecimal("0.20")),
            new Tier(new BigDecimal("1000"), new BigDecimal("3000"), new BigDecimal("0.25")),
            new Tier(new BigDecimal("3000"), new BigDecimal("5000"), new BigDecimal("0.30")),
            new Tier(new BigDecimal("5000"), null, new BigDecimal("0.35")));

    public CommissionQuote quote(BigDecimal salesBefore, BigDecimal orderAmount) {
        int tierIndex = tierIndexFor(salesBefore);
        BigDecimal rate = TIERS.get(tierIndex).getRate();
        BigDecimal commission = orderAmount.multiply(rate).setScale(2, RoundingMode.HALF_UP);
        BigDecimal newTotal = salesBefore.add(orderAmount);

        BigDecimal bonus = BigDecimal.ZERO.setScale(2);
        if (salesBefore.compareTo(BONUS_THRESHOLD) < 0 && newTotal.compareTo(BONUS_THRESHOLD) >= 0) {
            bonus = BONUS_AMOUNT;
        }

        return CommissionQuote.builder()
                .tier(tierIndex + 1)
                .rate(rate)
                .commissionAmount(commission)
                .bonus(bonus)
                .newTotalSales(newTotal)
                .build();
    }

    /** 1-based tier for the given cumulative sales. */
    public int tierFor(BigDecimal totalSales) {
        return tierIndexFor(totalSales) + 1;
    }

    private int tierIndexFor(BigDecimal totalSales) {
        for (int i = 0; i < TIERS.size(); i++) {
            Tier tier = TIERS.get(i);
            if (tier.getMax() == null || totalSales.compareTo(tier.getMax()) < 0) {
                return i;
            }
        }
        return TIERS.size() - 1;
    }

    @Value
    private static class Tier {
        BigDecimal min;
        BigDecimal max;
        BigDecimal rate;
    }
}
