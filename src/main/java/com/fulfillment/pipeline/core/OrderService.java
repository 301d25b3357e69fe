package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.compliance.AuditLogger;
import com.fulfillment.pipeline.domain.CreateOrderCommand;
import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderMutation;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.PaymentInitiation;
import com.fulfillment.pipeline.domain.ProductKind;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.persistence.service.OrderStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Operations offered to the front-end and to operators: create an order, read its status and
 * re-dispatch a stuck pipeline.
 */
@Slf4j
@Service
public class OrderService {

    static final String ORDER_ID_PREFIX = "ORD_";
    static final String FREE_PAYMENT_PREFIX = "FREE-";

    private final OrderStore orderStore;
    private final OrderStateMachine stateMachine;
    private final AffiliateService affiliateService;
    private final SignatureVerifier signatureVerifier;
    private final FulfillmentDispatcher dispatcher;
    private final AuditLogger auditLogger;
    private final String secret;
    private final String currency;
    private final SecureRandom random = new SecureRandom();

    public OrderService(OrderStore orderStore,
                        OrderStateMachine stateMachine,
                        AffiliateService affiliateService,
                        SignatureVerifier signatureVerifier,
                        FulfillmentDispatcher dispatcher,
                        AuditLogger auditLogger,
                        @Value("${fulfillment.webhook.secret}") String secret,
                        @Value("${fulfillment.orders.currency:USD}") String currency) {
        this.orderStore = orderStore;
        this.stateMachine = stateMachine;
        this.affiliateService = affiliateService;
        this.signatureVerifier = signatureVerifier;
        this.dispatcher = dispatcher;
        this.auditLogger = auditLogger;
        this.secret = secret;
        this.currency = currency;
    }

    /**
     * Creates a {@code pending_payment} order priced from the product catalog and returns what the
     * front-end needs for checkout. Free products skip checkout and go straight to fulfillment.
     *
     * @throws InvalidOrderRequestException if the user, product or required input is missing
     */
    public PaymentInitiation createOrder(CreateOrderCommand command) {
        validate(command);
        String affiliateCode = resolveAffiliate(command.getAffiliateCode());
        ProductKind kind = command.getProductKind();
        BigDecimal amount = kind.getPrice();
        String orderId = newOrderId();

        OrderSnapshot order = orderStore.create(orderId, command.getUserRef(), kind, command.getInput(),
                amount, currency, affiliateCode);
        auditLogger.logOrderCreated(order);

        if (amount.signum() == 0) {
            order = confirmFreeOrder(order);
        }

        return PaymentInitiation.builder()
                .orderId(orderId)
                .status(order.getStatus())
                .amount(amount)
                .currency(currency)
                .signature(signatureVerifier.sign(orderId + "|" + amount.toPlainString() + "|" + currency, secret))
                .build();
    }

    /**
     * @throws OrderNotFoundException if there is no such order
     */
    public OrderSnapshot getOrderStatus(String orderId) {
        return orderStore.get(orderId);
    }

    /**
     * Re-dispatches the pipeline of an order stuck in {@code paid} or {@code generating}. A run that
     * is still active keeps its lease and the new one exits immediately.
     */
    public OrderSnapshot resume(String orderId) {
        OrderSnapshot order = orderStore.get(orderId);
        if (!order.getStatus().isInFlight()) {
            throw new InvalidOrderRequestException("Order " + orderId + " has no pipeline to resume (status="
                    + order.getStatus().getWireValue() + ")");
        }
        log.info("Resuming pipeline: orderId={}, status={}", orderId, order.getStatus());
        dispatcher.dispatch(order, false);
        return order;
    }

    private OrderSnapshot confirmFreeOrder(OrderSnapshot order) {
        TransitionOutcome outcome = stateMachine.fire(order.getOrderId(), LifecycleEvent.PAYMENT_CONFIRMED,
                OrderMutation.builder()
                        .paymentReference(FREE_PAYMENT_PREFIX + order.getOrderId())
                        .paymentMethod("free")
                        .build());
        if (outcome.isApplied()) {
            auditLogger.logTransition(outcome);
            dispatcher.dispatch(outcome.getOrder(), false);
        }
        return outcome.getOrder();
    }

    private void validate(CreateOrderCommand command) {
        if (command.getUserRef() == null || command.getUserRef().isBlank()) {
            throw new InvalidOrderRequestException("user_ref is required");
        }
        if (command.getProductKind() == null) {
            throw new InvalidOrderRequestException("product_kind is required");
        }
        Map<String, Object> input = command.getInput() != null ? command.getInput() : Map.of();
        List<String> missing = command.getProductKind().getRequiredInputFields().stream()
                .filter(field -> input.get(field) == null || input.get(field).toString().isBlank())
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new InvalidOrderRequestException("Missing required input for " + command.getProductKind() + ": " + missing);
        }
    }

    private String resolveAffiliate(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        if (!affiliateService.exists(code)) {
            log.warn("Unknown affiliate code dropped: affiliateCode={}", code);
            return null;
        }
        return code;
    }

    private String newOrderId() {
        byte[] bytes = new byte[4];
        random.nextBytes(bytes);
        return ORDER_ID_PREFIX + Instant.now().getEpochSecond() + "_" + HexFormat.of().withUpperCase().formatHex(bytes);
    }
}
