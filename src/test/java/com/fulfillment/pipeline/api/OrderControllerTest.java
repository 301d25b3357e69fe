package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.core.InvalidOrderRequestException;
import com.fulfillment.pipeline.core.OrderNotFoundException;
import com.fulfillment.pipeline.core.OrderService;
import com.fulfillment.pipeline.domain.CreateOrderCommand;
import com.fulfillment.pipeline.domain.OrderSnapshot;
import com.fulfillment.pipeline.domain.OrderStatus;
import com.fulfillment.pipeline.domain.PaymentInitiation;
import com.fulfillment.pipeline.domain.ProductKind;
import com.fulfillment.pipeline.domain.RefundState;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {OrderController.class, HealthController.class})
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrderService orderService;

    @Test
    void createReturns201WithPaymentInitiation() throws Exception {
        when(orderService.createOrder(any())).thenReturn(PaymentInitiation.builder()
                .orderId("ORD_1700000000_0A1B2C3D")
                .status(OrderStatus.PENDING_PAYMENT)
                .amount(new BigDecimal("9.99"))
                .currency("USD")
                .signature("f00d")
                .build());

        mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "userRef": "user-1",
                                  "productKind": "NAME_INTERPRETATION",
                                  "input": { "name": "Ada" },
                                  "affiliateCode": "AFF_ABCDEFGH"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orderId").value("ORD_1700000000_0A1B2C3D"))
                .andExpect(jsonPath("$.status").value("pending_payment"))
                .andExpect(jsonPath("$.amount").value(9.99))
                .andExpect(jsonPath("$.signature").value("f00d"));

        ArgumentCaptor<CreateOrderCommand> command = ArgumentCaptor.forClass(CreateOrderCommand.class);
        verify(orderService).createOrder(command.capture());
        assertThat(command.getValue().getProductKind()).isEqualTo(ProductKind.NAME_INTERPRETATION);
        assertThat(command.getValue().getInput()).containsEntry("name", "Ada");
        assertThat(command.getValue().getAffiliateCode()).isEqualTo("AFF_ABCDEFGH");
    }

    @Test
    void missingUserRefFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productKind\": \"WEEKLY_HOROSCOPE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.userRef").exists());

        verify(orderService, never()).createOrder(any());
    }

    @Test
    void missingProductInputReturns400() throws Exception {
        when(orderService.createOrder(any()))
                .thenThrow(new InvalidOrderRequestException("Missing required input for WEEKLY_HOROSCOPE: [zodiac]"));

        mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userRef\": \"user-1\", \"productKind\": \"WEEKLY_HOROSCOPE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ORDER_REQUEST"));
    }

    @Test
    void getReturnsWireStatus() throws Exception {
        when(orderService.getOrderStatus("ORD_1")).thenReturn(OrderSnapshot.builder()
                .orderId("ORD_1")
                .userRef("user-1")
                .productKind(ProductKind.WEEKLY_HOROSCOPE)
                .status(OrderStatus.COMPLETED)
                .amount(new BigDecimal("4.99"))
                .currency("USD")
                .generatedContent("A good week for Leo.")
                .refundState(RefundState.NONE)
                .createdAt(Instant.now())
                .build());

        mockMvc.perform(get("/api/v1/orders/ORD_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.generatedContent").value("A good week for Leo."));
    }

    @Test
    void unknownOrderReturns404() throws Exception {
        when(orderService.getOrderStatus("ORD_404")).thenThrow(new OrderNotFoundException("ORD_404"));

        mockMvc.perform(get("/api/v1/orders/ORD_404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void healthNeedsNoBackingServices() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
