package com.fulfillment.pipeline.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fulfillment.pipeline.compliance.AuditLogger;
import com.fulfillment.pipeline.domain.AdmissionResult;
import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderMutation;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.PaymentWebhookEvent;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.domain.WebhookOutcome;
import com.fulfillment.pipeline.persistence.service.OrderStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Synchronous part of webhook handling: authenticate, parse, deduplicate and apply the payment
 * transition. Fulfillment is only dispatched after the transition has committed.
 *
 * <p>Every outcome except a bad signature, an unparsable body or a persistent write conflict is
 * acknowledged to the provider so it stops retrying.
 */
@Slf4j
@Service
public class WebhookIngestionService {

    static final String CANCELLED_MESSAGE = "Payment cancelled by user";
    static final String BODY_DIGEST_PREFIX = "sha256:";
    static final int MAX_EVENT_ID_LENGTH = 128;
    static final int MAX_PAYMENT_REFERENCE_LENGTH = 255;

    private final SignatureVerifier signatureVerifier;
    private final EventDeduplicator deduplicator;
    private final OrderStateMachine stateMachine;
    private final OrderStore orderStore;
    private final PaymentOutcomeHandler outcomeHandler;
    private final AuditLogger auditLogger;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final String secret;
    private final int maxConflictAttempts;

    public WebhookIngestionService(SignatureVerifier signatureVerifier,
                                   EventDeduplicator deduplicator,
                                   OrderStateMachine stateMachine,
                                   OrderStore orderStore,
                                   PaymentOutcomeHandler outcomeHandler,
                                   AuditLogger auditLogger,
                                   ObjectMapper objectMapper,
                                   TransactionTemplate transactionTemplate,
                                   @Value("${fulfillment.webhook.secret}") String secret,
                                   @Value("${fulfillment.webhook.max-conflict-attempts:3}") int maxConflictAttempts) {
        this.signatureVerifier = signatureVerifier;
        this.deduplicator = deduplicator;
        this.stateMachine = stateMachine;
        this.orderStore = orderStore;
        this.outcomeHandler = outcomeHandler;
        this.auditLogger = auditLogger;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.secret = secret;
        this.maxConflictAttempts = Math.max(1, maxConflictAttempts);
    }

    /**
     * @throws InvalidSignatureException if the signature does not match the raw body
     * @throws MalformedWebhookException if the authenticated body is not a usable event
     * @throws OptimisticLockingFailureException if the order kept changing under every attempt
     */
    public WebhookOutcome ingest(byte[] rawBody, String signatureHeader) {
        if (!signatureVerifier.verify(rawBody, signatureHeader, secret)) {
            log.warn("Webhook rejected: invalid signature (bodyLength={})", rawBody != null ? rawBody.length : 0);
            throw new InvalidSignatureException("Invalid webhook signature");
        }

        PaymentWebhookEvent event = parse(rawBody);
        String orderId = event.getOrderId();
        String eventId = resolveEventId(event, rawBody);
        String providerStatus = event.getStatus();

        Optional<LifecycleEvent> lifecycle = mapStatus(providerStatus);
        if (lifecycle.isEmpty()) {
            log.info("Webhook ignored, unhandled status: orderId={}, eventId={}, status={}", orderId, eventId, providerStatus);
            return decided(orderId, eventId, providerStatus, WebhookOutcome.IGNORED);
        }

        Optional<OrderSnapshot> order = orderStore.find(orderId);
        if (order.isEmpty()) {
            log.error("Webhook for unknown order: orderId={}, eventId={}, status={}", orderId, eventId, providerStatus);
            return decided(orderId, eventId, providerStatus, WebhookOutcome.ORDER_NOT_FOUND);
        }
        if (lifecycle.get() == LifecycleEvent.PAYMENT_CONFIRMED && !matchesOrder(order.get(), event)) {
            log.error("[OPERATOR] Paid webhook does not match order: orderId={}, eventId={}, expected={} {}, got={} {}",
                    orderId, eventId, order.get().getAmount(), order.get().getCurrency(), event.getAmount(), event.getCurrency());
            return decided(orderId, eventId, providerStatus, WebhookOutcome.IGNORED);
        }

        OrderMutation mutation = toMutation(lifecycle.get(), event, eventId);
        TransitionOutcome outcome;
        try {
            outcome = applyWithConflictRetry(orderId, eventId, lifecycle.get(), mutation);
        } catch (DuplicateEventException e) {
            return decided(orderId, eventId, providerStatus, WebhookOutcome.DUPLICATE);
        } catch (OrderNotFoundException e) {
            log.error("Order disappeared during webhook handling: orderId={}, eventId={}", orderId, eventId);
            return decided(orderId, eventId, providerStatus, WebhookOutcome.ORDER_NOT_FOUND);
        }

        if (outcome.isStale()) {
            log.info("Webhook stale: orderId={}, eventId={}, event={}, currentStatus={}",
                    orderId, eventId, lifecycle.get(), outcome.getOrder().getStatus());
            return decided(orderId, eventId, providerStatus, WebhookOutcome.STALE);
        }

        auditLogger.logTransition(outcome);
        outcomeHandler.onApplied(outcome);
        return decided(orderId, eventId, providerStatus, WebhookOutcome.APPLIED);
    }

    private TransitionOutcome applyWithConflictRetry(String orderId, String eventId, LifecycleEvent lifecycle,
                                                     OrderMutation mutation) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> {
                    if (deduplicator.admit(orderId, eventId) == AdmissionResult.DUPLICATE) {
                        throw new DuplicateEventException(orderId, eventId);
                    }
                    return stateMachine.apply(orderId, lifecycle, mutation);
                });
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= maxConflictAttempts) {
                    log.error("Webhook write conflict persisted: orderId={}, eventId={}, attempts={}", orderId, eventId, attempt);
                    throw e;
                }
                log.warn("Webhook write conflict, re-reading: orderId={}, eventId={}, attempt={}", orderId, eventId, attempt);
            }
        }
    }

    private PaymentWebhookEvent parse(byte[] rawBody) {
        PaymentWebhookEvent event;
        try {
            event = objectMapper.readValue(rawBody, PaymentWebhookEvent.class);
        } catch (JsonProcessingException e) {
            throw new MalformedWebhookException("Webhook body is not valid JSON", e);
        } catch (IOException e) {
            throw new MalformedWebhookException("Webhook body could not be read", e);
        }
        if (event == null || isBlank(event.getOrderId())) {
            throw new MalformedWebhookException("Webhook body has no order_id");
        }
        if (isBlank(event.getStatus())) {
            throw new MalformedWebhookException("Webhook body has no status");
        }
        if (PaymentWebhookEvent.STATUS_PAID.equalsIgnoreCase(event.getStatus()) && isBlank(event.getPaymentReference())) {
            throw new MalformedWebhookException("Paid webhook has no payment_reference");
        }
        if (event.getPaymentReference() != null && event.getPaymentReference().length() > MAX_PAYMENT_REFERENCE_LENGTH) {
            throw new MalformedWebhookException("payment_reference exceeds " + MAX_PAYMENT_REFERENCE_LENGTH + " characters");
        }
        return event;
    }

    static Optional<LifecycleEvent> mapStatus(String status) {
        if (status == null) {
            return Optional.empty();
        }
        switch (status.toLowerCase(Locale.ROOT)) {
            case PaymentWebhookEvent.STATUS_PAID:
                return Optional.of(LifecycleEvent.PAYMENT_CONFIRMED);
            case PaymentWebhookEvent.STATUS_FAILED:
            case PaymentWebhookEvent.STATUS_CANCELLED:
                return Optional.of(LifecycleEvent.PAYMENT_FAILED);
            default:
                return Optional.empty();
        }
    }

    private static OrderMutation toMutation(LifecycleEvent lifecycle, PaymentWebhookEvent event, String eventId) {
        if (lifecycle == LifecycleEvent.PAYMENT_CONFIRMED) {
            return OrderMutation.builder()
                    .paymentReference(event.getPaymentReference())
                    .paymentMethod(event.getPaymentMethod())
                    .processedEventId(eventId)
                    .build();
        }
        String message = PaymentWebhookEvent.STATUS_CANCELLED.equalsIgnoreCase(event.getStatus())
                ? CANCELLED_MESSAGE
                : (isBlank(event.getErrorMessage()) ? "Payment failed" : event.getErrorMessage());
        return OrderMutation.builder()
                .errorMessage(message)
                .processedEventId(eventId)
                .build();
    }

    private static boolean matchesOrder(OrderSnapshot order, PaymentWebhookEvent event) {
        if (event.getAmount() != null && event.getAmount().compareTo(order.getAmount()) != 0) {
            return false;
        }
        return event.getCurrency() == null || event.getCurrency().equalsIgnoreCase(order.getCurrency());
    }

    /**
     * Provider event id, or a digest of the exact body when the delivery carries none. Ids longer
     * than the processed-event key allows are replaced by their digest.
     */
    static String resolveEventId(PaymentWebhookEvent event, byte[] rawBody) {
        String eventId = event.getEventId();
        if (isBlank(eventId)) {
            return sha256(rawBody);
        }
        if (eventId.length() > MAX_EVENT_ID_LENGTH) {
            return sha256(eventId.getBytes(StandardCharsets.UTF_8));
        }
        return eventId;
    }

    private static String sha256(byte[] bytes) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(bytes);
            return BODY_DIGEST_PREFIX + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private WebhookOutcome decided(String orderId, String eventId, String providerStatus, WebhookOutcome outcome) {
        auditLogger.logWebhook(orderId, eventId, providerStatus, outcome);
        return outcome;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
