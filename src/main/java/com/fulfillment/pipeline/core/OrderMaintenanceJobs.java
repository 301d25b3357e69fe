package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderMutation;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.persistence.service.AffiliateLedgerService;
import com.fulfillment.pipeline.persistence.service.OrderStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic housekeeping: resumes pipelines interrupted by a restart, expires unpaid orders,
 * settles compensations that never finished, books affiliate credits missed after completion
 * and purges old dedup records.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fulfillment.maintenance.enabled", havingValue = "true", matchIfMissing = true)
public class OrderMaintenanceJobs {

    static final String PAYMENT_TIMEOUT_MESSAGE = "Payment timeout";

    private final OrderStore orderStore;
    private final OrderStateMachine stateMachine;
    private final FulfillmentDispatcher dispatcher;
    private final PaymentOutcomeHandler outcomeHandler;
    private final RefundOrchestrator refundOrchestrator;
    private final EventDeduplicator deduplicator;
    private final AffiliateLedgerService affiliateLedgerService;
    private final Duration staleAfter;
    private final Duration paymentTimeout;
    private final Duration dedupRetention;

    public OrderMaintenanceJobs(OrderStore orderStore,
                                OrderStateMachine stateMachine,
                                FulfillmentDispatcher dispatcher,
                                PaymentOutcomeHandler outcomeHandler,
                                RefundOrchestrator refundOrchestrator,
                                EventDeduplicator deduplicator,
                                AffiliateLedgerService affiliateLedgerService,
                                @Value("${fulfillment.recovery.stale-after:2m}") Duration staleAfter,
                                @Value("${fulfillment.payment.timeout:30m}") Duration paymentTimeout,
                                @Value("${fulfillment.dedup.retention:30d}") Duration dedupRetention) {
        this.orderStore = orderStore;
        this.stateMachine = stateMachine;
        this.dispatcher = dispatcher;
        this.outcomeHandler = outcomeHandler;
        this.refundOrchestrator = refundOrchestrator;
        this.deduplicator = deduplicator;
        this.affiliateLedgerService = affiliateLedgerService;
        this.staleAfter = staleAfter;
        this.paymentTimeout = paymentTimeout;
        this.dedupRetention = dedupRetention;
    }

    /** Re-dispatches paid/generating orders nobody has touched recently. Leases skip live runs. */
    @Scheduled(fixedDelayString = "${fulfillment.recovery.fixed-delay-ms:60000}",
               initialDelayString = "${fulfillment.recovery.initial-delay-ms:30000}")
    public void recoverStalledPipelines() {
        List<String> ids = orderStore.findInFlightIdsNotUpdatedSince(Instant.now().minus(staleAfter));
        if (ids.isEmpty()) {
            return;
        }
        log.info("Recovering stalled pipelines: count={}", ids.size());
        for (String orderId : ids) {
            try {
                dispatcher.dispatch(orderStore.get(orderId), false);
            } catch (Exception e) {
                log.error("Recovery dispatch failed: orderId={}", orderId, e);
            }
        }
    }

    @Scheduled(fixedDelayString = "${fulfillment.payment.expiry-fixed-delay-ms:300000}")
    public void expireUnpaidOrders() {
        List<String> ids = orderStore.findUnpaidIdsCreatedBefore(Instant.now().minus(paymentTimeout));
        for (String orderId : ids) {
            try {
                TransitionOutcome outcome = stateMachine.fire(orderId, LifecycleEvent.PAYMENT_FAILED,
                        OrderMutation.builder().errorMessage(PAYMENT_TIMEOUT_MESSAGE).build());
                if (outcome.isApplied()) {
                    log.info("Unpaid order expired: orderId={}", orderId);
                    outcomeHandler.onApplied(outcome);
                }
            } catch (Exception e) {
                log.error("Expiring unpaid order failed: orderId={}", orderId, e);
            }
        }
    }

    /**
     * Failed orders whose compensation was requested but never settled. The refund orchestrator
     * decides from the refund record: none yet means the provider was never called.
     */
    @Scheduled(fixedDelayString = "${fulfillment.recovery.fixed-delay-ms:60000}",
               initialDelayString = "${fulfillment.recovery.initial-delay-ms:30000}")
    public void settleInterruptedRefunds() {
        List<String> ids = orderStore.findRefundRequestedIdsNotUpdatedSince(Instant.now().minus(staleAfter));
        for (String orderId : ids) {
            try {
                log.warn("Settling interrupted compensation: orderId={}", orderId);
                refundOrchestrator.compensate(orderId);
            } catch (Exception e) {
                log.error("Settling compensation failed: orderId={}", orderId, e);
            }
        }
    }

    /** Credits are booked after the completed transition commits; a crash in between leaves them out. */
    @Scheduled(fixedDelayString = "${fulfillment.recovery.fixed-delay-ms:60000}",
               initialDelayString = "${fulfillment.recovery.initial-delay-ms:30000}")
    public void creditMissedAffiliates() {
        List<String> ids = orderStore.findUncreditedAffiliateIdsCompletedBefore(Instant.now().minus(staleAfter));
        for (String orderId : ids) {
            try {
                log.warn("Crediting affiliate missed after completion: orderId={}", orderId);
                affiliateLedgerService.credit(orderStore.get(orderId));
            } catch (Exception e) {
                log.error("Missed affiliate credit failed: orderId={}", orderId, e);
            }
        }
    }

    @Scheduled(cron = "${fulfillment.dedup.purge-cron:0 30 3 * * *}")
    public void purgeProcessedEvents() {
        deduplicator.purgeProcessedBefore(Instant.now().minus(dedupRetention));
    }
}
