package com.fulfillment.pipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Commission owed to an affiliate for one order, priced against the affiliate's sales before it.
 */
@Value
@Builder
public class CommissionQuote {

    int tier;
    BigDecimal rate;
    BigDecimal commissionAmount;
    BigDecimal bonus;
    BigDecimal newTotalSales;

    public BigDecimal getTotalCommission() {
        return commissionAmount.add(bonus);
    }
}
