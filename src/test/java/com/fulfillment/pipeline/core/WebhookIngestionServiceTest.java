package com.fulfillment.pipeline.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fulfillment.pipeline.compliance.AuditLogger;
import com.fulfillment.pipeline.domain.AdmissionResult;
import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderMutation;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.OrderStatus;
import com.fulfillment.pipeline.domain.ProductKind;
import com.fulfillment.pipeline.domain.RefundState;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.domain.WebhookOutcome;
import com.fulfillment.pipeline.persistence.service.OrderStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookIngestionServiceTest {

    private static final String SECRET = "whsec_test";
    private static final String ORDER_ID = "ORD_1";

    @Mock private EventDeduplicator deduplicator;
    @Mock private OrderStateMachine stateMachine;
    @Mock private OrderStore orderStore;
    @Mock private PaymentOutcomeHandler outcomeHandler;
    @Mock private AuditLogger auditLogger;
    @Mock private PlatformTransactionManager transactionManager;

    private final SignatureVerifier signatureVerifier = new SignatureVerifier();
    private WebhookIngestionService service;

    @BeforeEach
    void setUp() {
        service = new WebhookIngestionService(signatureVerifier, deduplicator, stateMachine, orderStore, outcomeHandler,
                auditLogger, new ObjectMapper(), new TransactionTemplate(transactionManager), SECRET, 3);
    }

    private static OrderSnapshot pendingOrder() {
        return OrderSnapshot.builder()
                .orderId(ORDER_ID)
                .userRef("user-1")
                .productKind(ProductKind.NAME_INTERPRETATION)
                .status(OrderStatus.PENDING_PAYMENT)
                .amount(new BigDecimal("9.99"))
                .currency("USD")
                .refundState(RefundState.NONE)
                .build();
    }

    private static OrderSnapshot paidOrder() {
        return pendingOrder().toBuilder().status(OrderStatus.PAID).paymentReference("pay_1").build();
    }

    private WebhookOutcome deliver(String json) {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        return service.ingest(body, signatureVerifier.sign(body, SECRET));
    }

    @Test
    void paidEventIsAppliedAndHandedOn() {
        when(orderStore.find(ORDER_ID)).thenReturn(Optional.of(pendingOrder()));
        when(deduplicator.admit(ORDER_ID, "evt_1")).thenReturn(AdmissionResult.ACCEPTED);
        TransitionOutcome applied = TransitionOutcome.applied(LifecycleEvent.PAYMENT_CONFIRMED, OrderStatus.PENDING_PAYMENT, paidOrder());
        when(stateMachine.apply(eq(ORDER_ID), eq(LifecycleEvent.PAYMENT_CONFIRMED), any())).thenReturn(applied);

        WebhookOutcome outcome = deliver("""
                {"order_id":"ORD_1","status":"paid","payment_reference":"pay_1","payment_method":"card",
                 "amount":9.99,"currency":"USD","event_id":"evt_1"}
                """);

        assertThat(outcome).isEqualTo(WebhookOutcome.APPLIED);
        ArgumentCaptor<OrderMutation> mutation = ArgumentCaptor.forClass(OrderMutation.class);
        verify(stateMachine).apply(eq(ORDER_ID), eq(LifecycleEvent.PAYMENT_CONFIRMED), mutation.capture());
        assertThat(mutation.getValue().getPaymentReference()).isEqualTo("pay_1");
        assertThat(mutation.getValue().getPaymentMethod()).isEqualTo("card");
        assertThat(mutation.getValue().getProcessedEventId()).isEqualTo("evt_1");
        verify(outcomeHandler).onApplied(applied);
        verify(auditLogger).logWebhook(ORDER_ID, "evt_1", "paid", WebhookOutcome.APPLIED);
    }

    @Test
    void invalidSignatureIsRejectedBeforeParsing() {
        byte[] body = "{\"order_id\":\"ORD_1\",\"status\":\"paid\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> service.ingest(body, signatureVerifier.sign(body, "wrong-secret")))
                .isInstanceOf(InvalidSignatureException.class);
        verifyNoInteractions(orderStore, deduplicator, stateMachine);
    }

    @Test
    void signedButMalformedBodyIsRejected() {
        assertThatThrownBy(() -> deliver("{not json")).isInstanceOf(MalformedWebhookException.class);
        assertThatThrownBy(() -> deliver("{\"status\":\"paid\"}")).isInstanceOf(MalformedWebhookException.class);
        assertThatThrownBy(() -> deliver("{\"order_id\":\"ORD_1\",\"status\":\"paid\"}"))
                .isInstanceOf(MalformedWebhookException.class)
                .hasMessageContaining("payment_reference");
        verifyNoInteractions(deduplicator, stateMachine);
    }

    @Test
    void redeliveredEventIsDuplicateAndHasNoSideEffects() {
        when(orderStore.find(ORDER_ID)).thenReturn(Optional.of(paidOrder()));
        when(deduplicator.admit(ORDER_ID, "evt_1")).thenReturn(AdmissionResult.DUPLICATE);

        WebhookOutcome outcome = deliver("""
                {"order_id":"ORD_1","status":"paid","payment_reference":"pay_1","event_id":"evt_1"}
                """);

        assertThat(outcome).isEqualTo(WebhookOutcome.DUPLICATE);
        verify(stateMachine, never()).apply(any(), any(), any());
        verifyNoInteractions(outcomeHandler);
    }

    @Test
    void paidAfterCompletionIsStale() {
        OrderSnapshot completed = paidOrder().toBuilder().status(OrderStatus.COMPLETED).build();
        when(orderStore.find(ORDER_ID)).thenReturn(Optional.of(completed));
        when(deduplicator.admit(ORDER_ID, "evt_2")).thenReturn(AdmissionResult.ACCEPTED);
        when(stateMachine.apply(eq(ORDER_ID), eq(LifecycleEvent.PAYMENT_CONFIRMED), any()))
                .thenReturn(TransitionOutcome.stale(LifecycleEvent.PAYMENT_CONFIRMED, completed));

        WebhookOutcome outcome = deliver("""
                {"order_id":"ORD_1","status":"paid","payment_reference":"pay_1","event_id":"evt_2"}
                """);

        assertThat(outcome).isEqualTo(WebhookOutcome.STALE);
        verifyNoInteractions(outcomeHandler);
    }

    @Test
    void unknownOrderIsAcknowledged() {
        when(orderStore.find("ORD_404")).thenReturn(Optional.empty());

        WebhookOutcome outcome = deliver("""
                {"order_id":"ORD_404","status":"failed","event_id":"evt_1"}
                """);

        assertThat(outcome).isEqualTo(WebhookOutcome.ORDER_NOT_FOUND);
        verifyNoInteractions(deduplicator, stateMachine);
    }

    @Test
    void unhandledStatusIsIgnored() {
        WebhookOutcome outcome = deliver("""
                {"order_id":"ORD_1","status":"pending","event_id":"evt_1"}
                """);

        assertThat(outcome).isEqualTo(WebhookOutcome.IGNORED);
        verifyNoInteractions(orderStore, deduplicator, stateMachine);
    }

    @Test
    void paidAmountMismatchIsNotApplied() {
        when(orderStore.find(ORDER_ID)).thenReturn(Optional.of(pendingOrder()));

        WebhookOutcome outcome = deliver("""
                {"order_id":"ORD_1","status":"paid","payment_reference":"pay_1","amount":1.00,"currency":"USD","event_id":"evt_1"}
                """);

        assertThat(outcome).isEqualTo(WebhookOutcome.IGNORED);
        verifyNoInteractions(deduplicator, stateMachine);
    }

    @Test
    void cancelledPaymentFailsOrderWithFixedMessage() {
        OrderSnapshot failed = pendingOrder().toBuilder().status(OrderStatus.FAILED).build();
        when(orderStore.find(ORDER_ID)).thenReturn(Optional.of(pendingOrder()));
        when(deduplicator.admit(eq(ORDER_ID), anyString())).thenReturn(AdmissionResult.ACCEPTED);
        when(stateMachine.apply(eq(ORDER_ID), eq(LifecycleEvent.PAYMENT_FAILED), any()))
                .thenReturn(TransitionOutcome.applied(LifecycleEvent.PAYMENT_FAILED, OrderStatus.PENDING_PAYMENT, failed));

        WebhookOutcome outcome = deliver("""
                {"order_id":"ORD_1","status":"cancelled","event_id":"evt_c"}
                """);

        assertThat(outcome).isEqualTo(WebhookOutcome.APPLIED);
        ArgumentCaptor<OrderMutation> mutation = ArgumentCaptor.forClass(OrderMutation.class);
        verify(stateMachine).apply(eq(ORDER_ID), eq(LifecycleEvent.PAYMENT_FAILED), mutation.capture());
        assertThat(mutation.getValue().getErrorMessage()).isEqualTo("Payment cancelled by user");
        assertThat(mutation.getValue().getPaymentReference()).isNull();
    }

    @Test
    void missingEventIdFallsBackToBodyDigest() {
        when(orderStore.find(ORDER_ID)).thenReturn(Optional.of(paidOrder()));
        when(deduplicator.admit(eq(ORDER_ID), anyString())).thenReturn(AdmissionResult.DUPLICATE);
        String json = "{\"order_id\":\"ORD_1\",\"status\":\"failed\"}";

        deliver(json);
        deliver(json);

        ArgumentCaptor<String> eventIds = ArgumentCaptor.forClass(String.class);
        verify(deduplicator, times(2)).admit(eq(ORDER_ID), eventIds.capture());
        assertThat(eventIds.getAllValues().get(0))
                .startsWith("sha256:")
                .isEqualTo(eventIds.getAllValues().get(1));
    }

    @Test
    void oversizedEventIdIsHashedToFitTheDedupKey() {
        when(orderStore.find(ORDER_ID)).thenReturn(Optional.of(paidOrder()));
        when(deduplicator.admit(eq(ORDER_ID), anyString())).thenReturn(AdmissionResult.DUPLICATE);
        String longId = "evt_" + "9".repeat(196);
        String json = "{\"order_id\":\"ORD_1\",\"status\":\"failed\",\"event_id\":\"" + longId + "\"}";

        assertThat(deliver(json)).isEqualTo(WebhookOutcome.DUPLICATE);
        assertThat(deliver(json)).isEqualTo(WebhookOutcome.DUPLICATE);

        ArgumentCaptor<String> eventIds = ArgumentCaptor.forClass(String.class);
        verify(deduplicator, times(2)).admit(eq(ORDER_ID), eventIds.capture());
        assertThat(eventIds.getAllValues().get(0))
                .startsWith("sha256:")
                .hasSizeLessThanOrEqualTo(WebhookIngestionService.MAX_EVENT_ID_LENGTH)
                .isEqualTo(eventIds.getAllValues().get(1));
    }

    @Test
    void oversizedPaymentReferenceIsRejected() {
        String json = """
                {"order_id":"ORD_1","status":"paid","payment_reference":"%s","payment_method":"card",
                 "amount":9.99,"currency":"USD","event_id":"evt_1"}
                """.formatted("p".repeat(WebhookIngestionService.MAX_PAYMENT_REFERENCE_LENGTH + 1));

        assertThatThrownBy(() -> deliver(json))
                .isInstanceOf(MalformedWebhookException.class)
                .hasMessageContaining("payment_reference");
        verifyNoInteractions(deduplicator, stateMachine);
    }

    @Test
    void writeConflictIsRetriedWithFreshAdmission() {
        when(orderStore.find(ORDER_ID)).thenReturn(Optional.of(pendingOrder()));
        when(deduplicator.admit(ORDER_ID, "evt_1")).thenReturn(AdmissionResult.ACCEPTED);
        TransitionOutcome applied = TransitionOutcome.applied(LifecycleEvent.PAYMENT_CONFIRMED, OrderStatus.PENDING_PAYMENT, paidOrder());
        when(stateMachine.apply(eq(ORDER_ID), eq(LifecycleEvent.PAYMENT_CONFIRMED), any()))
                .thenThrow(new OptimisticLockingFailureException("version changed"))
                .thenReturn(applied);

        WebhookOutcome outcome = deliver("""
                {"order_id":"ORD_1","status":"paid","payment_reference":"pay_1","event_id":"evt_1"}
                """);

        assertThat(outcome).isEqualTo(WebhookOutcome.APPLIED);
        verify(deduplicator, times(2)).admit(ORDER_ID, "evt_1");
        verify(outcomeHandler, times(1)).onApplied(applied);
    }

    @Test
    void statusMappingIsCaseInsensitive() {
        assertThat(WebhookIngestionService.mapStatus("PAID")).contains(LifecycleEvent.PAYMENT_CONFIRMED);
        assertThat(WebhookIngestionService.mapStatus("Failed")).contains(LifecycleEvent.PAYMENT_FAILED);
        assertThat(WebhookIngestionService.mapStatus("refunded")).isEmpty();
    }
}
