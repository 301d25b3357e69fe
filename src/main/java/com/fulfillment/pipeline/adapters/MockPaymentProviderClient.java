package com.fulfillment.pipeline.adapters;

import com.fulfillment.pipeline.core.PaymentProviderClient;
import com.fulfillment.pipeline.domain.RefundRequest;
import com.fulfillment.pipeline.domain.RefundResult;
import com.fulfillment.pipeline.domain.RefundStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Mock payment provider. Refunds succeed unless the payment reference starts with
 * {@code fail_refund}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fulfillment.adapters.mock.enabled", havingValue = "true", matchIfMissing = true)
public class MockPaymentProviderClient implements PaymentProviderClient {

    private static final String FAIL_PREFIX = "fail_refund";

    @Override
    public RefundResult issueRefund(RefundRequest request) {
        log.debug("MockPaymentProviderClient refunding refundKey={}, amount={}", request.getIdempotencyKey(), request.getAmount());

        if (request.getPaymentReference().startsWith(FAIL_PREFIX)) {
            return RefundResult.builder()
                    .idempotencyKey(request.getIdempotencyKey())
                    .paymentReference(request.getPaymentReference())
                    .status(RefundStatus.FAILED)
                    .amount(request.getAmount())
                    .currencyCode(request.getCurrencyCode())
                    .failureCode("MOCK_REFUND_DECLINED")
                    .message("Simulated refund decline")
                    .timestamp(Instant.now())
                    .build();
        }

        return RefundResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .paymentReference(request.getPaymentReference())
                .providerRefundId("mock-refund-" + UUID.randomUUID())
                .status(RefundStatus.SUCCESS)
                .amount(request.getAmount())
                .currencyCode(request.getCurrencyCode())
                .message("Refund processed successfully")
                .timestamp(Instant.now())
                .build();
    }
}
