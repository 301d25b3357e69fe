package com.fulfillment.pipeline.persistence.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fulfillment.pipeline.core.OrderNotFoundException;
import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderMutation;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.OrderStatus;
import com.fulfillment.pipeline.domain.ProductKind;
import com.fulfillment.pipeline.domain.RefundState;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.persistence.entity.AffiliateEntity;
import com.fulfillment.pipeline.persistence.entity.AffiliateLedgerEntryEntity;
import com.fulfillment.pipeline.persistence.entity.OrderTransitionEntity;
import com.fulfillment.pipeline.persistence.repository.AffiliateLedgerRepository;
import com.fulfillment.pipeline.persistence.repository.AffiliateRepository;
import com.fulfillment.pipeline.persistence.repository.OrderTransitionRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OrderStore against an embedded database.
 */
@DataJpaTest
@Import({OrderStore.class, OrderStoreTest.JsonConfig.class})
class OrderStoreTest {

    @TestConfiguration
    static class JsonConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Autowired
    private OrderStore orderStore;

    @Autowired
    private OrderTransitionRepository transitionRepository;

    @Autowired
    private AffiliateRepository affiliateRepository;

    @Autowired
    private AffiliateLedgerRepository ledgerRepository;

    private OrderSnapshot create(String orderId, ProductKind kind) {
        return orderStore.create(orderId, "user-1", kind, Map.of("name", "Ada"), kind.getPrice(), "USD", null);
    }

    private OrderMutation paid(String reference) {
        return OrderMutation.builder().paymentReference(reference).paymentMethod("card").processedEventId("evt_1").build();
    }

    @Test
    void createdOrderIsPendingWithInputRoundTripped() {
        OrderSnapshot order = create("ORD_1", ProductKind.NAME_INTERPRETATION);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING_PAYMENT);
        assertThat(order.getRefundState()).isEqualTo(RefundState.NONE);
        assertThat(order.getVersion()).isNotNull();
        assertThat(orderStore.get("ORD_1").getUserInput()).containsEntry("name", "Ada");
    }

    @Test
    void appliesLegalTransitionAndRecordsHistory() {
        create("ORD_1", ProductKind.NAME_INTERPRETATION);

        TransitionOutcome outcome = orderStore.applyTransition("ORD_1", LifecycleEvent.PAYMENT_CONFIRMED, paid("pay_1"));

        assertThat(outcome.isApplied()).isTrue();
        assertThat(outcome.getPreviousStatus()).isEqualTo(OrderStatus.PENDING_PAYMENT);
        assertThat(outcome.getOrder().getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(outcome.getOrder().getPaymentReference()).isEqualTo("pay_1");
        assertThat(outcome.getOrder().getLastProcessedEventId()).isEqualTo("evt_1");
        List<OrderTransitionEntity> history = transitionRepository.findByOrderIdOrderByIdAsc("ORD_1");
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getToStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(history.get(0).getEventId()).isEqualTo("evt_1");
    }

    @Test
    void illegalTransitionIsStaleAndWritesNothing() {
        create("ORD_1", ProductKind.NAME_INTERPRETATION);
        orderStore.applyTransition("ORD_1", LifecycleEvent.PAYMENT_CONFIRMED, paid("pay_1"));
        orderStore.applyTransition("ORD_1", LifecycleEvent.ENRICHMENT_DONE, OrderMutation.NONE);
        orderStore.applyTransition("ORD_1", LifecycleEvent.GENERATION_DONE,
                OrderMutation.builder().generatedContent("report").build());

        TransitionOutcome late = orderStore.applyTransition("ORD_1", LifecycleEvent.PIPELINE_ERROR,
                OrderMutation.builder().errorMessage("late failure").build());

        assertThat(late.isStale()).isTrue();
        OrderSnapshot current = orderStore.get("ORD_1");
        assertThat(current.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(current.getErrorMessage()).isNull();
        assertThat(current.getCompletedAt()).isNotNull();
        assertThat(transitionRepository.findByOrderIdOrderByIdAsc("ORD_1")).hasSize(3);
    }

    @Test
    void paymentReferenceIsNeverOverwritten() {
        create("ORD_1", ProductKind.NAME_INTERPRETATION);
        orderStore.applyTransition("ORD_1", LifecycleEvent.PAYMENT_CONFIRMED, paid("pay_1"));

        orderStore.applyTransition("ORD_1", LifecycleEvent.PIPELINE_ERROR, OrderMutation.builder()
                .paymentReference("pay_other")
                .errorMessage("boom")
                .refundState(RefundState.REQUESTED)
                .build());

        OrderSnapshot failed = orderStore.get("ORD_1");
        assertThat(failed.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(failed.getPaymentReference()).isEqualTo("pay_1");
        assertThat(failed.getRefundState()).isEqualTo(RefundState.REQUESTED);
    }

    @Test
    void confirmationWithoutReferenceIsRejected() {
        create("ORD_1", ProductKind.NAME_INTERPRETATION);

        assertThatThrownBy(() -> orderStore.applyTransition("ORD_1", LifecycleEvent.PAYMENT_CONFIRMED, OrderMutation.NONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void enrichmentDataIsKeptOnlyForProductsThatNeedIt() {
        create("ORD_CHART", ProductKind.BIRTH_CHART);
        create("ORD_NAME", ProductKind.NAME_INTERPRETATION);
        OrderMutation enriched = OrderMutation.builder().enrichmentData("{\"pillars\":4}").build();
        orderStore.applyTransition("ORD_CHART", LifecycleEvent.PAYMENT_CONFIRMED, paid("pay_1"));
        orderStore.applyTransition("ORD_NAME", LifecycleEvent.PAYMENT_CONFIRMED, paid("pay_2"));

        orderStore.applyTransition("ORD_CHART", LifecycleEvent.ENRICHMENT_DONE, enriched);
        orderStore.applyTransition("ORD_NAME", LifecycleEvent.ENRICHMENT_DONE, enriched);

        assertThat(orderStore.get("ORD_CHART").getEnrichmentData()).isEqualTo("{\"pillars\":4}");
        assertThat(orderStore.get("ORD_NAME").getEnrichmentData()).isNull();
        assertThat(orderStore.get("ORD_NAME").getStatus()).isEqualTo(OrderStatus.GENERATING);
    }

    @Test
    void refundCompletionRequiresCapturedPayment() {
        create("ORD_1", ProductKind.NAME_INTERPRETATION);
        orderStore.applyTransition("ORD_1", LifecycleEvent.PAYMENT_FAILED,
                OrderMutation.builder().errorMessage("Payment failed").build());

        TransitionOutcome outcome = orderStore.applyTransition("ORD_1", LifecycleEvent.REFUND_DONE, OrderMutation.NONE);

        assertThat(outcome.isStale()).isTrue();
        assertThat(orderStore.get("ORD_1").getStatus()).isEqualTo(OrderStatus.FAILED);
    }

    @Test
    void refundFlagMovesOnlyFromExpectedState() {
        create("ORD_1", ProductKind.NAME_INTERPRETATION);
        orderStore.applyTransition("ORD_1", LifecycleEvent.PAYMENT_CONFIRMED, paid("pay_1"));
        orderStore.applyTransition("ORD_1", LifecycleEvent.PIPELINE_ERROR,
                OrderMutation.builder().errorMessage("boom").refundState(RefundState.REQUESTED).build());

        boolean wrongSource = orderStore.updateRefundState("ORD_1", EnumSet.of(RefundState.NONE),
                RefundState.PENDING_MANUAL, null);
        boolean moved = orderStore.updateRefundState("ORD_1", EnumSet.of(RefundState.REQUESTED),
                RefundState.PENDING_MANUAL, "provider declined");

        assertThat(wrongSource).isFalse();
        assertThat(moved).isTrue();
        assertThat(orderStore.findRefundPending()).extracting(OrderSnapshot::getOrderId).containsExactly("ORD_1");
        assertThat(orderStore.get("ORD_1").getErrorMessage()).isEqualTo("provider declined");
    }

    @Test
    void maintenanceQueriesSelectByStatusAndAge() {
        create("ORD_PENDING", ProductKind.NAME_INTERPRETATION);
        create("ORD_PAID", ProductKind.NAME_INTERPRETATION);
        orderStore.applyTransition("ORD_PAID", LifecycleEvent.PAYMENT_CONFIRMED, paid("pay_1"));
        Instant future = Instant.now().plusSeconds(60);

        assertThat(orderStore.findUnpaidIdsCreatedBefore(future)).containsExactly("ORD_PENDING");
        assertThat(orderStore.findInFlightIdsNotUpdatedSince(future)).containsExactly("ORD_PAID");
        assertThat(orderStore.findInFlightIdsNotUpdatedSince(Instant.now().minusSeconds(60))).isEmpty();
    }

    @Test
    void oversizedProviderTextIsTruncatedToColumnWidth() {
        create("ORD_1", ProductKind.NAME_INTERPRETATION);
        orderStore.applyTransition("ORD_1", LifecycleEvent.PAYMENT_CONFIRMED, OrderMutation.builder()
                .paymentReference("pay_1")
                .paymentMethod("m".repeat(80))
                .processedEventId("evt_1")
                .build());
        orderStore.applyTransition("ORD_1", LifecycleEvent.PIPELINE_ERROR,
                OrderMutation.builder().errorMessage("e".repeat(5000)).refundState(RefundState.REQUESTED).build());

        boolean flagged = orderStore.updateRefundState("ORD_1", EnumSet.of(RefundState.REQUESTED),
                RefundState.PENDING_MANUAL, "Refund failed: " + "x".repeat(1200));

        OrderSnapshot order = orderStore.get("ORD_1");
        assertThat(flagged).isTrue();
        assertThat(order.getRefundState()).isEqualTo(RefundState.PENDING_MANUAL);
        assertThat(order.getErrorMessage()).hasSize(OrderStore.MAX_ERROR_MESSAGE_LENGTH).startsWith("Refund failed: ");
        assertThat(order.getPaymentMethod()).hasSize(OrderStore.MAX_PAYMENT_METHOD_LENGTH);
    }

    @Test
    void uncreditedAffiliateOrdersAreFoundUntilLedgerEntryExists() {
        affiliateRepository.saveAndFlush(AffiliateEntity.builder().code("AFF_KNOWN001").userRef("aff-user").build());
        orderStore.create("ORD_AFF", "user-1", ProductKind.NAME_INTERPRETATION, Map.of("name", "Ada"),
                ProductKind.NAME_INTERPRETATION.getPrice(), "USD", "AFF_KNOWN001");
        orderStore.create("ORD_GONE", "user-1", ProductKind.NAME_INTERPRETATION, Map.of("name", "Ada"),
                ProductKind.NAME_INTERPRETATION.getPrice(), "USD", "AFF_UNKNOWN1");
        for (String id : List.of("ORD_AFF", "ORD_GONE")) {
            orderStore.applyTransition(id, LifecycleEvent.PAYMENT_CONFIRMED, paid("pay_" + id));
            orderStore.applyTransition(id, LifecycleEvent.ENRICHMENT_DONE, OrderMutation.NONE);
            orderStore.applyTransition(id, LifecycleEvent.GENERATION_DONE,
                    OrderMutation.builder().generatedContent("report").build());
        }
        Instant future = Instant.now().plusSeconds(60);

        assertThat(orderStore.findUncreditedAffiliateIdsCompletedBefore(future)).containsExactly("ORD_AFF");
        assertThat(orderStore.findUncreditedAffiliateIdsCompletedBefore(Instant.now().minusSeconds(60))).isEmpty();

        ledgerRepository.saveAndFlush(AffiliateLedgerEntryEntity.builder()
                .affiliateCode("AFF_KNOWN001")
                .orderId("ORD_AFF")
                .orderAmount(ProductKind.NAME_INTERPRETATION.getPrice())
                .commissionRate(new BigDecimal("0.20"))
                .commissionAmount(new BigDecimal("2.00"))
                .bonusAmount(BigDecimal.ZERO)
                .tier(1)
                .build());

        assertThat(orderStore.findUncreditedAffiliateIdsCompletedBefore(future)).isEmpty();
    }

    @Test
    void unknownOrderIsNotFound() {
        assertThat(orderStore.find("ORD_NOPE")).isEmpty();
        assertThatThrownBy(() -> orderStore.get("ORD_NOPE")).isInstanceOf(OrderNotFoundException.class);
    }
}
