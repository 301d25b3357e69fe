package com.fulfillment.pipeline.messaging;

import com.fulfillment.pipeline.core.OrderTransitionedEvent;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes order lifecycle messages. Transitions are published only after the transaction that
 * applied them commits, so consumers never see a transition that was rolled back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventProducer {

    private final KafkaTemplate<String, OrderLifecycleMessage> kafkaTemplate;

    @Value("${fulfillment.kafka.topic.order-events:order-events}")
    private String topic;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTransition(OrderTransitionedEvent event) {
        OrderSnapshot order = event.getOrder();
        send(order.getOrderId(), OrderLifecycleMessage.builder()
                .messageId(UUID.randomUUID().toString())
                .orderId(order.getOrderId())
                .eventType(event.getEvent().name())
                .fromStatus(event.getFrom().getWireValue())
                .toStatus(order.getStatus().getWireValue())
                .productKind(order.getProductKind().name())
                .amount(order.getAmount())
                .currency(order.getCurrency())
                .refundState(order.getRefundState().name())
                .message(order.getErrorMessage())
                .timestamp(Instant.now())
                .build());
    }

    public void publishOperatorAlert(OrderSnapshot order, String reason) {
        send(order.getOrderId(), OrderLifecycleMessage.builder()
                .messageId(UUID.randomUUID().toString())
                .orderId(order.getOrderId())
                .eventType(OrderLifecycleMessage.OPERATOR_ALERT)
                .toStatus(order.getStatus().getWireValue())
                .productKind(order.getProductKind().name())
                .amount(order.getAmount())
                .currency(order.getCurrency())
                .refundState(order.getRefundState().name())
                .message(reason)
                .timestamp(Instant.now())
                .build());
    }

    private void send(String key, OrderLifecycleMessage message) {
        log.debug("Publishing order event: key={}, messageId={}, eventType={}", key, message.getMessageId(), message.getEventType());
        CompletableFuture<SendResult<String, OrderLifecycleMessage>> future;
        try {
            future = kafkaTemplate.send(topic, key, message);
        } catch (Exception e) {
            // the state change is already committed; the message is lost, not the transition
            log.error("Failed to publish order event key={} eventType={}", key, message.getEventType(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish order event key={} messageId={}", key, message.getMessageId(), ex);
            } else {
                log.debug("Published order event: key={}, messageId={}, partition={}, offset={}",
                        key, message.getMessageId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
