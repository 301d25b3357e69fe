package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderMutation;
import com.fulfillment.pipeline.domain.RefundState;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.persistence.service.OrderStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point for every order status change. Legal transitions are defined by
 * {@link LifecycleEvent}; requests that do not match the current status come back stale and write
 * nothing.
 *
 * <p>{@link #apply} joins the caller's transaction and makes a single attempt, for callers that
 * combine the transition with other writes. {@link #fire} runs in its own transaction and re-reads
 * after losing an optimistic race, up to a bounded number of attempts.
 */
@Slf4j
@Service
public class OrderStateMachine {

    private final OrderStore orderStore;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final int maxConflictAttempts;

    public OrderStateMachine(OrderStore orderStore,
                             ApplicationEventPublisher eventPublisher,
                             TransactionTemplate transactionTemplate,
                             @Value("${fulfillment.state-machine.max-conflict-attempts:3}") int maxConflictAttempts) {
        this.orderStore = orderStore;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = transactionTemplate;
        this.maxConflictAttempts = Math.max(1, maxConflictAttempts);
    }

    @Transactional
    public TransitionOutcome apply(String orderId, LifecycleEvent event, OrderMutation mutation) {
        TransitionOutcome outcome = orderStore.applyTransition(orderId, event, mutation);
        if (outcome.isApplied()) {
            eventPublisher.publishEvent(new OrderTransitionedEvent(event, outcome.getPreviousStatus(), outcome.getOrder()));
        }
        return outcome;
    }

    public TransitionOutcome fire(String orderId, LifecycleEvent event, OrderMutation mutation) {
        return withConflictRetry(orderId, event.name(),
                () -> transactionTemplate.execute(status -> apply(orderId, event, mutation)));
    }

    /**
     * Sets the refund flag on a failed order. Not a status transition, but written under the same
     * versioned check.
     */
    public boolean flagRefund(String orderId, Set<RefundState> expected, RefundState target, String errorMessage) {
        Boolean updated = withConflictRetry(orderId, "REFUND_FLAG_" + target,
                () -> orderStore.updateRefundState(orderId, expected, target, errorMessage));
        return Boolean.TRUE.equals(updated);
    }

    private <T> T withConflictRetry(String orderId, String action, Supplier<T> write) {
        for (int attempt = 1; ; attempt++) {
            try {
                return write.get();
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= maxConflictAttempts) {
                    log.error("Order write conflict persisted, giving up: orderId={}, action={}, attempts={}",
                            orderId, action, attempt);
                    throw e;
                }
                log.warn("Order write conflict, re-reading: orderId={}, action={}, attempt={}", orderId, action, attempt);
            }
        }
    }
}
