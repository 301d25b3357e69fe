package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.core.InvalidOrderRequestException;
import com.fulfillment.pipeline.core.OrderService;
import com.fulfillment.pipeline.core.RefundOrchestrator;
import com.fulfillment.pipeline.domain.LifecycleEvent;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.OrderStatus;
import com.fulfillment.pipeline.domain.ProductKind;
import com.fulfillment.pipeline.domain.RefundState;
import com.fulfillment.pipeline.domain.TransitionOutcome;
import com.fulfillment.pipeline.persistence.service.OrderStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AdminOrderController.class)
class AdminOrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrderStore orderStore;

    @MockitoBean
    private OrderService orderService;

    @MockitoBean
    private RefundOrchestrator refundOrchestrator;

    private static OrderSnapshot order(OrderStatus status, RefundState refundState) {
        return OrderSnapshot.builder()
                .orderId("ORD_1")
                .userRef("user-1")
                .productKind(ProductKind.BIRTH_CHART)
                .status(status)
                .amount(new BigDecimal("29.99"))
                .currency("USD")
                .paymentReference("pay_123456789")
                .refundState(refundState)
                .build();
    }

    @Test
    void listsOrdersAwaitingManualRefund() throws Exception {
        when(orderStore.findRefundPending()).thenReturn(List.of(order(OrderStatus.FAILED, RefundState.PENDING_MANUAL)));

        mockMvc.perform(get("/api/v1/admin/orders/refund-pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].orderId").value("ORD_1"))
                .andExpect(jsonPath("$[0].refundState").value("PENDING_MANUAL"));
    }

    @Test
    void resolvingRefundReturnsRefundedOrder() throws Exception {
        when(refundOrchestrator.resolveManually("ORD_1", "ops-alice", "re_manual_1"))
                .thenReturn(TransitionOutcome.applied(LifecycleEvent.REFUND_DONE, OrderStatus.FAILED,
                        order(OrderStatus.REFUNDED, RefundState.COMPLETED)));

        mockMvc.perform(post("/api/v1/admin/orders/ORD_1/refund-resolved")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operator\": \"ops-alice\", \"providerRefundId\": \"re_manual_1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("refunded"));
    }

    @Test
    void resolvingRequiresOperator() throws Exception {
        mockMvc.perform(post("/api/v1/admin/orders/ORD_1/refund-resolved")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(refundOrchestrator, never()).resolveManually(any(), any(), any());
    }

    @Test
    void resumingTerminalOrderReturns400() throws Exception {
        when(orderService.resume("ORD_1")).thenThrow(new InvalidOrderRequestException("Order ORD_1 has no pipeline to resume"));

        mockMvc.perform(post("/api/v1/admin/orders/ORD_1/resume"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ORDER_REQUEST"));
    }

    @Test
    void resumingInFlightOrderIsAccepted() throws Exception {
        when(orderService.resume("ORD_1")).thenReturn(order(OrderStatus.GENERATING, RefundState.NONE));

        mockMvc.perform(post("/api/v1/admin/orders/ORD_1/resume"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("generating"));
    }
}
