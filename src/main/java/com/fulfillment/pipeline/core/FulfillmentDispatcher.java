package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.OrderSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Hands paid orders to the fulfillment worker pool so the webhook can be acknowledged immediately.
 * Nothing thrown by a run escapes the worker; an interrupted run is picked up by the recovery sweep.
 */
@Slf4j
@Component
public class FulfillmentDispatcher {

    private final TaskExecutor fulfillmentExecutor;
    private final FulfillmentOrchestrator orchestrator;
    private final PipelineLeaseService leaseService;
    private final NotificationService notificationService;

    public FulfillmentDispatcher(@Qualifier("fulfillmentExecutor") TaskExecutor fulfillmentExecutor,
                                 FulfillmentOrchestrator orchestrator,
                                 PipelineLeaseService leaseService,
                                 NotificationService notificationService) {
        this.fulfillmentExecutor = fulfillmentExecutor;
        this.orchestrator = orchestrator;
        this.leaseService = leaseService;
        this.notificationService = notificationService;
    }

    /**
     * @param paymentAck the order was just paid and the user should get the payment acknowledgement
     * @return false if the worker pool rejected the task
     */
    public boolean dispatch(OrderSnapshot order, boolean paymentAck) {
        String orderId = order.getOrderId();
        try {
            fulfillmentExecutor.execute(() -> runGuarded(order, paymentAck));
            log.debug("Fulfillment dispatched: orderId={}", orderId);
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Fulfillment pool saturated, order left for recovery: orderId={}", orderId);
            return false;
        }
    }

    private void runGuarded(OrderSnapshot order, boolean paymentAck) {
        String orderId = order.getOrderId();
        if (paymentAck) {
            notificationService.paymentAcknowledged(order);
        }
        PipelineLeaseService.Lease lease = leaseService.tryAcquire(orderId);
        if (!lease.isAcquired()) {
            return;
        }
        try {
            orchestrator.run(orderId);
        } catch (Exception e) {
            log.error("Fulfillment run aborted: orderId={}", orderId, e);
        } finally {
            leaseService.release(lease);
        }
    }
}
