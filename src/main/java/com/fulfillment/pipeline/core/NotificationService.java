package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.DeliveryStatus;
import com.fulfillment.pipeline.domain.MessageKind;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Best-effort user messaging. Payment acknowledgements and reports are retried a bounded number of
 * times; nothing here ever fails an order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final Notifier notifier;
    private final StepExecutor stepExecutor;

    public DeliveryStatus paymentAcknowledged(OrderSnapshot order) {
        return send(order, MessageKind.PAYMENT_ACK,
                "Payment received for order " + order.getOrderId() + ". Your "
                        + order.getProductKind().getDisplayName() + " is being prepared.");
    }

    public DeliveryStatus reportReady(OrderSnapshot order) {
        return send(order, MessageKind.REPORT_READY, order.getGeneratedContent());
    }

    public DeliveryStatus failure(OrderSnapshot order, String reason) {
        return send(order, MessageKind.FAILURE,
                "We could not complete order " + order.getOrderId() + ": " + reason);
    }

    public DeliveryStatus refundDone(OrderSnapshot order) {
        return send(order, MessageKind.REFUND_DONE,
                "Order " + order.getOrderId() + " has been refunded: " + order.getAmount() + " " + order.getCurrency());
    }

    DeliveryStatus send(OrderSnapshot order, MessageKind kind, String payload) {
        String orderId = order.getOrderId();
        try {
            DeliveryStatus status;
            if (kind.isRetried()) {
                status = stepExecutor.execute(StepExecutor.NOTIFICATION, orderId, () -> deliverOrThrow(order, kind, payload));
            } else {
                status = notifier.notify(order.getUserRef(), kind, payload);
            }
            if (status == DeliveryStatus.DELIVERED) {
                log.info("Notification delivered: orderId={}, kind={}", orderId, kind);
            } else {
                log.warn("Notification not delivered: orderId={}, kind={}", orderId, kind);
            }
            return status;
        } catch (Exception e) {
            log.warn("Notification failed: orderId={}, kind={}, error={}", orderId, kind, e.getMessage());
            return DeliveryStatus.FAILED;
        }
    }

    private DeliveryStatus deliverOrThrow(OrderSnapshot order, MessageKind kind, String payload) {
        DeliveryStatus status = notifier.notify(order.getUserRef(), kind, payload);
        if (status != DeliveryStatus.DELIVERED) {
            throw new IllegalStateException("Notifier reported " + status);
        }
        return status;
    }
}
