package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.domain.PaymentInitiation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CreateOrderResponseDto {

    String orderId;
    String status;
    BigDecimal amount;
    String currency;
    /** HMAC of orderId|amount|currency, passed along to the checkout link. */
    String signature;

    public static CreateOrderResponseDto from(PaymentInitiation initiation) {
        return CreateOrderResponseDto.builder()
                .orderId(initiation.getOrderId())
                .status(initiation.getStatus().getWireValue())
                .amount(initiation.getAmount())
                .currency(initiation.getCurrency())
                .signature(initiation.getSignature())
                .build();
    }
}
