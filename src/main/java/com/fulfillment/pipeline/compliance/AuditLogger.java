package com.fulfillment.pipeline.compliance;

import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.RefundResult;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.domain.WebhookOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes [AUDIT] lines for money-relevant decisions: orders created, webhooks decided, transitions
 * applied and refunds attempted.
 */
@Slf4j
@Component
public class AuditLogger {

    public void logOrderCreated(OrderSnapshot order) {
        log.info("[AUDIT] ORDER_CREATED orderId={} product={} amount={} currency={} affiliate={} input={}",
                order.getOrderId(),
                order.getProductKind(),
                order.getAmount(),
                order.getCurrency(),
                order.getAffiliateCode(),
                UserInputMasker.mask(order.getUserInput()));
    }

    public void logWebhook(String orderId, String eventId, String providerStatus, WebhookOutcome outcome) {
        log.info("[AUDIT] WEBHOOK orderId={} eventId={} providerStatus={} outcome={}",
                orderId, eventId, providerStatus, outcome);
    }

    public void logTransition(TransitionOutcome outcome) {
        OrderSnapshot order = outcome.getOrder();
        log.info("[AUDIT] TRANSITION orderId={} event={} from={} to={} paymentRef={}",
                order.getOrderId(),
                outcome.getEvent(),
                outcome.getPreviousStatus(),
                order.getStatus(),
                UserInputMasker.maskPaymentReference(order.getPaymentReference()));
    }

    public void logRefund(String orderId, RefundResult result) {
        log.info("[AUDIT] REFUND orderId={} refundKey={} status={} amount={} currency={} providerRefundId={} failureCode={}",
                orderId,
                result.getIdempotencyKey(),
                result.getStatus(),
                result.getAmount(),
                result.getCurrencyCode(),
                result.getProviderRefundId(),
                result.getFailureCode());
    }

    public void logManualRefundResolved(String orderId, String operator) {
        log.info("[AUDIT] REFUND_RESOLVED_MANUALLY orderId={} operator={}", orderId, operator);
    }
}
