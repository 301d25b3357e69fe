package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.domain.OrderSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response body for GET /api/v1/orders/{orderId}. Generated content is included once the order is
 * completed.
 */
@Value
@Builder
public class OrderStatusResponseDto {

    String orderId;
    String userRef;
    String productKind;
    String status;
    BigDecimal amount;
    String currency;
    boolean requiresEnrichment;
    String paymentMethod;
    String generatedContent;
    String affiliateCode;
    String errorMessage;
    String refundState;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;

    public static OrderStatusResponseDto from(OrderSnapshot order) {
        return OrderStatusResponseDto.builder()
                .orderId(order.getOrderId())
                .userRef(order.getUserRef())
                .productKind(order.getProductKind().name())
                .status(order.getStatus().getWireValue())
                .amount(order.getAmount())
                .currency(order.getCurrency())
                .requiresEnrichment(order.isRequiresEnrichment())
                .paymentMethod(order.getPaymentMethod())
                .generatedContent(order.getGeneratedContent())
                .affiliateCode(order.getAffiliateCode())
                .errorMessage(order.getErrorMessage())
                .refundState(order.getRefundState().name())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .completedAt(order.getCompletedAt())
                .build();
    }
}
