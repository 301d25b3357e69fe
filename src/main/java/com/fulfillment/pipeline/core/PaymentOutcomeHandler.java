package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Side effects of payment transitions, run after the transition has committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentOutcomeHandler {

    private final FulfillmentDispatcher dispatcher;
    private final NotificationService notificationService;

    public void onApplied(TransitionOutcome outcome) {
        OrderSnapshot order = outcome.getOrder();
        switch (outcome.getEvent()) {
            case PAYMENT_CONFIRMED:
                dispatcher.dispatch(order, true);
                break;
            case PAYMENT_FAILED:
                notificationService.failure(order,
                        order.getErrorMessage() != null ? order.getErrorMessage() : "payment was not completed");
                break;
            default:
                log.debug("No payment side effect for event={}", outcome.getEvent());
        }
    }
}
