package com.fulfillment.pipeline.persistence.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fulfillment.pipeline.core.InvalidOrderRequestException;
import com.fulfillment.pipeline.core.OrderNotFoundException;
import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderMutation;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.OrderStatus;
import com.fulfillment.pipeline.domain.ProductKind;
import com.fulfillment.pipeline.domain.RefundState;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.persistence.entity.OrderEntity;
import com.fulfillment.pipeline.persistence.entity.OrderTransitionEntity;
import com.fulfillment.pipeline.persistence.repository.OrderRepository;
import com.fulfillment.pipeline.persistence.repository.OrderTransitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sole owner of order durability. Writes are versioned: a writer that loses a race on the same
 * order gets an {@link org.springframework.dao.OptimisticLockingFailureException} on flush and
 * nothing it attempted is kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderStore {

    static final int MAX_ERROR_MESSAGE_LENGTH = 1000;
    static final int MAX_PAYMENT_METHOD_LENGTH = 50;

    private static final TypeReference<Map<String, Object>> INPUT_TYPE = new TypeReference<>() {};

    private final OrderRepository orderRepository;
    private final OrderTransitionRepository transitionRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public OrderSnapshot create(String orderId, String userRef, ProductKind productKind, Map<String, Object> input,
                                BigDecimal amount, String currency, String affiliateCode) {
        OrderEntity entity = OrderEntity.builder()
                .orderId(orderId)
                .userRef(userRef)
                .productKind(productKind)
                .requiresEnrichment(productKind.requiresEnrichment())
                .status(OrderStatus.PENDING_PAYMENT)
                .amount(amount)
                .currencyCode(currency)
                .userInput(writeInput(input))
                .affiliateCode(affiliateCode)
                .refundState(RefundState.NONE)
                .build();
        OrderEntity saved = orderRepository.saveAndFlush(entity);
        log.info("Order created: orderId={}, product={}, amount={} {}", orderId, productKind, amount, currency);
        return toSnapshot(saved);
    }

    @Transactional(readOnly = true)
    public Optional<OrderSnapshot> find(String orderId) {
        return orderRepository.findById(orderId).map(this::toSnapshot);
    }

    @Transactional(readOnly = true)
    public OrderSnapshot get(String orderId) {
        return find(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /**
     * Applies {@code event} if the order's current status is one of the event's allowed sources.
     * Otherwise nothing is written and a stale outcome is returned.
     *
     * @throws OrderNotFoundException if the order does not exist
     * @throws org.springframework.dao.OptimisticLockingFailureException if another writer changed
     *         the order between the read and the write
     */
    @Transactional
    public TransitionOutcome applyTransition(String orderId, LifecycleEvent event, OrderMutation mutation) {
        OrderEntity entity = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        OrderStatus from = entity.getStatus();

        if (!event.isAllowedFrom(from)) {
            log.debug("Stale transition: orderId={}, event={}, currentStatus={}", orderId, event, from);
            return TransitionOutcome.stale(event, toSnapshot(entity));
        }
        if (event == LifecycleEvent.REFUND_DONE && entity.getPaymentReference() == null) {
            log.warn("Refund completion for order that never captured payment: orderId={}", orderId);
            return TransitionOutcome.stale(event, toSnapshot(entity));
        }

        applyMutation(entity, event, mutation);
        entity.setStatus(event.getTarget());
        if (event.getTarget() == OrderStatus.COMPLETED) {
            entity.setCompletedAt(Instant.now());
        }
        OrderEntity saved = orderRepository.saveAndFlush(entity);

        transitionRepository.save(OrderTransitionEntity.builder()
                .orderId(orderId)
                .event(event)
                .fromStatus(from)
                .toStatus(event.getTarget())
                .eventId(mutation.getProcessedEventId())
                .build());

        log.info("Order transition applied: orderId={}, event={}, {} -> {}", orderId, event, from, event.getTarget());
        return TransitionOutcome.applied(event, from, toSnapshot(saved));
    }

    /**
     * Moves the refund flag of a failed order without changing its status. Returns false when the
     * order is not failed or its flag is not in {@code expected}.
     */
    @Transactional
    public boolean updateRefundState(String orderId, Set<RefundState> expected, RefundState target, String errorMessage) {
        OrderEntity entity = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (entity.getStatus() != OrderStatus.FAILED || !expected.contains(entity.getRefundState())) {
            log.debug("Refund state unchanged: orderId={}, status={}, refundState={}",
                    orderId, entity.getStatus(), entity.getRefundState());
            return false;
        }
        entity.setRefundState(target);
        if (errorMessage != null) {
            entity.setErrorMessage(truncate(errorMessage, MAX_ERROR_MESSAGE_LENGTH));
        }
        orderRepository.saveAndFlush(entity);
        log.info("Order refund state updated: orderId={}, refundState={}", orderId, target);
        return true;
    }

    @Transactional(readOnly = true)
    public List<OrderSnapshot> findRefundPending() {
        return orderRepository.findByStatusAndRefundStateOrderByUpdatedAtAsc(OrderStatus.FAILED, RefundState.PENDING_MANUAL)
                .stream()
                .map(this::toSnapshot)
                .collect(Collectors.toList());
    }

    /** Orders in {@code paid} or {@code generating} that have not been touched since {@code before}. */
    @Transactional(readOnly = true)
    public List<String> findInFlightIdsNotUpdatedSince(Instant before) {
        return orderRepository.findIdsByStatusInUpdatedBefore(EnumSet.of(OrderStatus.PAID, OrderStatus.GENERATING), before);
    }

    @Transactional(readOnly = true)
    public List<String> findUnpaidIdsCreatedBefore(Instant before) {
        return orderRepository.findIdsByStatusCreatedBefore(OrderStatus.PENDING_PAYMENT, before);
    }

    @Transactional(readOnly = true)
    public List<String> findRefundRequestedIdsNotUpdatedSince(Instant before) {
        return orderRepository.findIdsByRefundStateUpdatedBefore(RefundState.REQUESTED, before);
    }

    /** Completed orders with a known affiliate but no ledger entry, finished before {@code before}. */
    @Transactional(readOnly = true)
    public List<String> findUncreditedAffiliateIdsCompletedBefore(Instant before) {
        return orderRepository.findIdsWithUncreditedAffiliateCompletedBefore(OrderStatus.COMPLETED, before);
    }

    private void applyMutation(OrderEntity entity, LifecycleEvent event, OrderMutation mutation) {
        if (mutation.getPaymentReference() != null) {
            if (entity.getPaymentReference() == null) {
                entity.setPaymentReference(mutation.getPaymentReference());
            } else if (!entity.getPaymentReference().equals(mutation.getPaymentReference())) {
                log.warn("Ignoring attempt to overwrite payment reference: orderId={}", entity.getOrderId());
            }
        }
        if (event == LifecycleEvent.PAYMENT_CONFIRMED && entity.getPaymentReference() == null) {
            throw new IllegalArgumentException("payment_confirmed requires a payment reference: " + entity.getOrderId());
        }
        if (mutation.getPaymentMethod() != null) {
            entity.setPaymentMethod(truncate(mutation.getPaymentMethod(), MAX_PAYMENT_METHOD_LENGTH));
        }
        if (mutation.getEnrichmentData() != null) {
            if (entity.isRequiresEnrichment()) {
                entity.setEnrichmentData(mutation.getEnrichmentData());
            } else {
                log.warn("Dropping enrichment data for product without enrichment: orderId={}", entity.getOrderId());
            }
        }
        if (mutation.getGeneratedContent() != null) {
            entity.setGeneratedContent(mutation.getGeneratedContent());
        }
        if (mutation.getErrorMessage() != null) {
            entity.setErrorMessage(truncate(mutation.getErrorMessage(), MAX_ERROR_MESSAGE_LENGTH));
        }
        if (mutation.getRefundState() != null) {
            entity.setRefundState(mutation.getRefundState());
        }
        if (mutation.getProcessedEventId() != null) {
            entity.setLastProcessedEventId(mutation.getProcessedEventId());
        }
    }

    /** Provider and downstream messages are free text of any length. */
    private static String truncate(String value, int maxLength) {
        if (value.length() > maxLength) {
            return value.substring(0, maxLength);
        }
        return value;
    }

    private String writeInput(Map<String, Object> input) {
        try {
            return objectMapper.writeValueAsString(input != null ? input : Collections.emptyMap());
        } catch (JsonProcessingException e) {
            throw new InvalidOrderRequestException("Order input is not serializable", e);
        }
    }

    private Map<String, Object> readInput(String orderId, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, INPUT_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Stored order input is not valid JSON: orderId={}", orderId, e);
            return Collections.emptyMap();
        }
    }

    private OrderSnapshot toSnapshot(OrderEntity entity) {
        return OrderSnapshot.builder()
                .orderId(entity.getOrderId())
                .userRef(entity.getUserRef())
                .productKind(entity.getProductKind())
                .requiresEnrichment(entity.isRequiresEnrichment())
                .status(entity.getStatus())
                .amount(entity.getAmount())
                .currency(entity.getCurrencyCode())
                .userInput(readInput(entity.getOrderId(), entity.getUserInput()))
                .paymentReference(entity.getPaymentReference())
                .paymentMethod(entity.getPaymentMethod())
                .enrichmentData(entity.getEnrichmentData())
                .generatedContent(entity.getGeneratedContent())
                .affiliateCode(entity.getAffiliateCode())
                .lastProcessedEventId(entity.getLastProcessedEventId())
                .errorMessage(entity.getErrorMessage())
                .refundState(entity.getRefundState())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .completedAt(entity.getCompletedAt())
                .build();
    }
}
