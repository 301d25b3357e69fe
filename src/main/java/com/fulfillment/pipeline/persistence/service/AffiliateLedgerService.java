package com.fulfillment.pipeline.persistence.service;

import com.fulfillment.pipeline.core.CommissionCalculator;
import com.fulfillment.pipeline.domain.CommissionQuote;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.persistence.entity.AffiliateEntity;
import com.fulfillment.pipeline.persistence.entity.AffiliateLedgerEntryEntity;
import com.fulfillment.pipeline.persistence.repository.AffiliateLedgerRepository;
import com.fulfillment.pipeline.persistence.repository.AffiliateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Credits affiliate commission for completed orders. One ledger entry per order; the affiliate row
 * is locked while totals are read and rewritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AffiliateLedgerService {

    private final AffiliateRepository affiliateRepository;
    private final AffiliateLedgerRepository ledgerRepository;
    private final CommissionCalculator commissionCalculator;

    /**
     * Credits the order's affiliate. Returns the quote that was booked, or empty when the order has
     * no affiliate, the affiliate is unknown, or the order was already credited.
     */
    @Transactional
    public Optional<CommissionQuote> credit(OrderSnapshot order) {
        if (!order.hasAffiliate()) {
            return Optional.empty();
        }
        Optional<AffiliateEntity> affiliateOpt = affiliateRepository.findForUpdate(order.getAffiliateCode());
        if (affiliateOpt.isEmpty()) {
            log.warn("Affiliate not found for completed order: orderId={}, affiliateCode={}",
                    order.getOrderId(), order.getAffiliateCode());
            return Optional.empty();
        }
        // checked under the affiliate row lock, so concurrent credits for one order serialize here
        if (ledgerRepository.existsByOrderId(order.getOrderId())) {
            log.info("Affiliate commission already credited: orderId={}", order.getOrderId());
            return Optional.empty();
        }

        AffiliateEntity affiliate = affiliateOpt.get();
        CommissionQuote quote = commissionCalculator.quote(affiliate.getTotalSales(), order.getAmount());

        ledgerRepository.save(AffiliateLedgerEntryEntity.builder()
                .affiliateCode(affiliate.getCode())
                .orderId(order.getOrderId())
                .orderAmount(order.getAmount())
                .commissionRate(quote.getRate())
                .commissionAmount(quote.getCommissionAmount())
                .bonusAmount(quote.getBonus())
                .tier(quote.getTier())
                .build());

        affiliate.setTotalSales(quote.getNewTotalSales());
        affiliate.setTotalCommission(affiliate.getTotalCommission().add(quote.getTotalCommission()));
        affiliate.setCurrentTier(commissionCalculator.tierFor(quote.getNewTotalSales()));
        if (quote.getBonus().signum() > 0) {
            affiliate.setBonusPaid(true);
        }
        affiliateRepository.save(affiliate);

        log.info("Affiliate credited: affiliateCode={}, orderId={}, rate={}, commission={}, bonus={}, tier={}",
                affiliate.getCode(), order.getOrderId(), quote.getRate(), quote.getCommissionAmount(),
                quote.getBonus(), affiliate.getCurrentTier());
        return Optional.of(quote);
    }
}
