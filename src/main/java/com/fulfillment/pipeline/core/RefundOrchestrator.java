package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.compliance.AuditLogger;
import com.fulfillment.pipeline.compliance.UserInputMasker;
import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderMutation;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.OrderStatus;
import com.fulfillment.pipeline.domain.RefundRequest;
import com.fulfillment.pipeline.domain.RefundResult;
import com.fulfillment.pipeline.domain.RefundState;
import com.fulfillment.pipeline.domain.RefundStatus;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.messaging.OrderEventProducer;
import com.fulfillment.pipeline.persistence.service.OrderStore;
import com.fulfillment.pipeline.persistence.service.RefundRecordService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Compensation for orders that failed after payment capture. The provider is asked for a refund at
 * most once per order; a failed or interrupted refund is handed to an operator instead of retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefundOrchestrator {

    static final String REFUND_KEY_PREFIX = "refund-";

    private final OrderStore orderStore;
    private final OrderStateMachine stateMachine;
    private final RefundRecordService refundRecordService;
    private final PaymentProviderClient paymentProviderClient;
    private final NotificationService notificationService;
    private final OrderEventProducer eventProducer;
    private final AuditLogger auditLogger;

    public static String refundKey(String orderId) {
        return REFUND_KEY_PREFIX + orderId;
    }

    /**
     * Refunds a failed order whose payment was captured. No-op for any other order.
     */
    public void compensate(String orderId) {
        OrderSnapshot order = orderStore.get(orderId);
        if (order.getStatus() != OrderStatus.FAILED) {
            log.info("Skipping compensation, order not failed: orderId={}, status={}", orderId, order.getStatus());
            return;
        }
        if (!order.hasCapturedPayment()) {
            log.info("No refund needed, nothing was captured: orderId={}, amount={}", orderId, order.getAmount());
            return;
        }

        Optional<RefundResult> existing = refundRecordService.findByOrderId(orderId);
        if (existing.isPresent()) {
            RefundResult previous = existing.get();
            if (previous.isSuccess()) {
                log.info("Refund already succeeded, completing order: orderId={}", orderId);
                completeRefund(orderId);
            } else {
                escalate(order, "Refund previously attempted with status " + previous.getStatus()
                        + "; not re-issued automatically");
            }
            return;
        }

        RefundRequest request = RefundRequest.builder()
                .idempotencyKey(refundKey(orderId))
                .orderId(orderId)
                .paymentReference(order.getPaymentReference())
                .amount(order.getAmount())
                .currencyCode(order.getCurrency())
                .reason(order.getErrorMessage() != null ? order.getErrorMessage() : "Fulfillment failed")
                .build();
        refundRecordService.createPending(request);

        log.info("Issuing refund: orderId={}, refundKey={}, amount={} {}",
                orderId, request.getIdempotencyKey(), request.getAmount(), request.getCurrencyCode());
        RefundResult result = issue(request);
        refundRecordService.recordOutcome(request.getIdempotencyKey(), result);
        auditLogger.logRefund(orderId, result);

        if (result.isSuccess()) {
            completeRefund(orderId);
        } else {
            escalate(orderStore.get(orderId), "Refund failed: " + result.getFailureCode() + " " + result.getMessage());
        }
    }

    /**
     * Records a refund an operator performed outside the system and moves the order to refunded.
     *
     * @throws InvalidOrderRequestException if the order is not waiting for a manual refund
     */
    public TransitionOutcome resolveManually(String orderId, String operator, String providerRefundId) {
        OrderSnapshot order = orderStore.get(orderId);
        if (order.getStatus() != OrderStatus.FAILED || order.getRefundState() != RefundState.PENDING_MANUAL) {
            throw new InvalidOrderRequestException("Order " + orderId + " is not awaiting a manual refund (status="
                    + order.getStatus().getWireValue() + ", refundState=" + order.getRefundState() + ")");
        }
        if (refundRecordService.findByOrderId(orderId).isEmpty()) {
            refundRecordService.createPending(RefundRequest.builder()
                    .idempotencyKey(refundKey(orderId))
                    .orderId(orderId)
                    .paymentReference(order.getPaymentReference())
                    .amount(order.getAmount())
                    .currencyCode(order.getCurrency())
                    .reason("Resolved manually")
                    .build());
        }
        refundRecordService.markResolved(orderId, operator, providerRefundId);
        auditLogger.logManualRefundResolved(orderId, operator);
        return completeRefund(orderId);
    }

    private RefundResult issue(RefundRequest request) {
        try {
            RefundResult result = paymentProviderClient.issueRefund(request);
            if (result == null || result.getStatus() == null) {
                return buildFailureResult(request, "INVALID_RESULT", "Provider returned an invalid refund result");
            }
            return result;
        } catch (Exception e) {
            log.error("Refund call failed: orderId={}, refundKey={}", request.getOrderId(), request.getIdempotencyKey(), e);
            return buildFailureResult(request, "REFUND_EXECUTION_FAILED", "Refund execution failed: " + e.getMessage());
        }
    }

    private TransitionOutcome completeRefund(String orderId) {
        TransitionOutcome outcome = stateMachine.fire(orderId, LifecycleEvent.REFUND_DONE,
                OrderMutation.builder().refundState(RefundState.COMPLETED).build());
        if (outcome.isApplied()) {
            auditLogger.logTransition(outcome);
            notificationService.refundDone(outcome.getOrder());
        } else {
            log.info("Refund completion was stale: orderId={}, status={}", orderId, outcome.getOrder().getStatus());
        }
        return outcome;
    }

    private void escalate(OrderSnapshot order, String reason) {
        stateMachine.flagRefund(order.getOrderId(), EnumSet.of(RefundState.NONE, RefundState.REQUESTED),
                RefundState.PENDING_MANUAL, reason);
        log.error("[OPERATOR] Manual refund required: orderId={}, paymentRef={}, amount={} {}, reason={}",
                order.getOrderId(), UserInputMasker.maskPaymentReference(order.getPaymentReference()), order.getAmount(), order.getCurrency(), reason);
        eventProducer.publishOperatorAlert(orderStore.get(order.getOrderId()), reason);
    }

    private static RefundResult buildFailureResult(RefundRequest request, String failureCode, String message) {
        return RefundResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .paymentReference(request.getPaymentReference())
                .status(RefundStatus.FAILED)
                .amount(request.getAmount())
                .currencyCode(request.getCurrencyCode())
                .failureCode(failureCode)
                .message(message)
                .timestamp(Instant.now())
                .build();
    }
}
