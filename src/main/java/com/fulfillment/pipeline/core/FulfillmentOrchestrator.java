package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.compliance.AuditLogger;
import com.fulfillment.pipeline.domain.EnrichmentRequest;
import com.fulfillment.pipeline.domain.GenerationRequest;
import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderMutation;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.RefundState;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.persistence.service.AffiliateLedgerService;
import com.fulfillment.pipeline.persistence.service.OrderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the fixed fulfillment pipeline for a paid order: enrichment (when the product needs it),
 * content generation, delivery and affiliate credit.
 *
 * <p>The order is re-read before every step and each step is skipped when its output is already
 * recorded, so re-running after a crash resumes where the previous run stopped. A step that
 * exhausts its retries moves the order to failed and starts compensation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FulfillmentOrchestrator {

    private final OrderStore orderStore;
    private final OrderStateMachine stateMachine;
    private final StepExecutor stepExecutor;
    private final EnrichmentProvider enrichmentProvider;
    private final ContentGenerator contentGenerator;
    private final NotificationService notificationService;
    private final AffiliateLedgerService affiliateLedgerService;
    private final RefundOrchestrator refundOrchestrator;
    private final AuditLogger auditLogger;

    public void run(String orderId) {
        try {
            while (true) {
                OrderSnapshot order = orderStore.get(orderId);
                switch (order.getStatus()) {
                    case PAID:
                        enrich(order);
                        break;
                    case GENERATING:
                        generate(order);
                        break;
                    default:
                        log.info("Pipeline idle: orderId={}, status={}", orderId, order.getStatus());
                        return;
                }
            }
        } catch (DownstreamException e) {
            log.warn("Pipeline step exhausted: orderId={}, step={}, error={}", orderId, e.getStep(), e.getMessage());
            fail(orderId, e);
        }
    }

    private void enrich(OrderSnapshot order) {
        String data = null;
        if (order.isRequiresEnrichment()) {
            data = order.hasEnrichmentData()
                    ? order.getEnrichmentData()
                    : stepExecutor.execute(StepExecutor.ENRICHMENT, order.getOrderId(),
                            () -> enrichmentProvider.fetchEnrichmentData(EnrichmentRequest.builder()
                                    .orderId(order.getOrderId())
                                    .productKind(order.getProductKind())
                                    .input(order.getUserInput())
                                    .build()));
        }
        TransitionOutcome outcome = stateMachine.fire(order.getOrderId(), LifecycleEvent.ENRICHMENT_DONE,
                OrderMutation.builder().enrichmentData(data).build());
        if (outcome.isApplied()) {
            auditLogger.logTransition(outcome);
        }
    }

    private void generate(OrderSnapshot order) {
        String content = order.hasGeneratedContent()
                ? order.getGeneratedContent()
                : stepExecutor.execute(StepExecutor.GENERATION, order.getOrderId(),
                        () -> requireContent(contentGenerator.generateContent(GenerationRequest.builder()
                                .orderId(order.getOrderId())
                                .productKind(order.getProductKind())
                                .input(order.getUserInput())
                                .enrichmentData(order.getEnrichmentData())
                                .build())));
        TransitionOutcome outcome = stateMachine.fire(order.getOrderId(), LifecycleEvent.GENERATION_DONE,
                OrderMutation.builder().generatedContent(content).build());
        if (outcome.isApplied()) {
            auditLogger.logTransition(outcome);
            onCompleted(outcome.getOrder());
        }
    }

    private void onCompleted(OrderSnapshot order) {
        notificationService.reportReady(order);
        if (order.hasAffiliate()) {
            try {
                affiliateLedgerService.credit(order);
            } catch (Exception e) {
                log.error("Affiliate credit failed: orderId={}, affiliateCode={}", order.getOrderId(), order.getAffiliateCode(), e);
            }
        }
    }

    private void fail(String orderId, DownstreamException cause) {
        OrderSnapshot current = orderStore.get(orderId);
        boolean captured = current.hasCapturedPayment();
        TransitionOutcome outcome = stateMachine.fire(orderId, LifecycleEvent.PIPELINE_ERROR, OrderMutation.builder()
                .errorMessage(cause.getMessage())
                .refundState(captured ? RefundState.REQUESTED : RefundState.NONE)
                .build());
        if (!outcome.isApplied()) {
            log.info("Pipeline error was stale: orderId={}, status={}", orderId, outcome.getOrder().getStatus());
            return;
        }
        auditLogger.logTransition(outcome);
        notificationService.failure(outcome.getOrder(), captured
                ? "we could not prepare your report, a refund has been initiated"
                : "we could not prepare your report");
        refundOrchestrator.compensate(orderId);
    }

    private static String requireContent(String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("Content generator returned no content");
        }
        return content;
    }
}
