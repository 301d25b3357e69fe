package com.fulfillment.pipeline.persistence.service;

import com.fulfillment.pipeline.domain.RefundRequest;
import com.fulfillment.pipeline.domain.RefundResult;
import com.fulfillment.pipeline.domain.RefundStatus;
import com.fulfillment.pipeline.persistence.entity.RefundEntity;
import com.fulfillment.pipeline.persistence.repository.RefundRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Persists refund records. A record is created as PENDING before the provider is called and then
 * moved to its outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefundRecordService {

    private final RefundRepository refundRepository;

    @Transactional(readOnly = true)
    public Optional<RefundResult> findByOrderId(String orderId) {
        return refundRepository.findByOrderId(orderId).map(this::toResult);
    }

    @Transactional
    public void createPending(RefundRequest request) {
        RefundEntity entity = RefundEntity.builder()
                .refundIdempotencyKey(request.getIdempotencyKey())
                .orderId(request.getOrderId())
                .paymentReference(request.getPaymentReference())
                .status(RefundStatus.PENDING)
                .amount(request.getAmount())
                .currencyCode(request.getCurrencyCode())
                .reason(request.getReason())
                .build();
        refundRepository.saveAndFlush(entity);
        log.debug("Persisted pending refund: refundIdempotencyKey={}", request.getIdempotencyKey());
    }

    @Transactional
    public void recordOutcome(String refundIdempotencyKey, RefundResult result) {
        RefundEntity entity = refundRepository.findById(refundIdempotencyKey)
                .orElseThrow(() -> new IllegalStateException("No refund record for key " + refundIdempotencyKey));
        entity.setStatus(result.getStatus());
        entity.setProviderRefundId(result.getProviderRefundId());
        entity.setFailureCode(result.getFailureCode());
        entity.setFailureMessage(truncate(result.getMessage()));
        refundRepository.save(entity);
        log.debug("Persisted refund outcome: refundIdempotencyKey={}, status={}", refundIdempotencyKey, result.getStatus());
    }

    /**
     * Marks the order's refund as completed by an operator outside the system.
     */
    @Transactional
    public void markResolved(String orderId, String operator, String providerRefundId) {
        RefundEntity entity = refundRepository.findByOrderId(orderId)
                .orElseThrow(() -> new IllegalStateException("No refund record for order " + orderId));
        entity.setStatus(RefundStatus.SUCCESS);
        entity.setResolvedBy(operator);
        if (providerRefundId != null) {
            entity.setProviderRefundId(providerRefundId);
        }
        refundRepository.save(entity);
    }

    private RefundResult toResult(RefundEntity entity) {
        return RefundResult.builder()
                .idempotencyKey(entity.getRefundIdempotencyKey())
                .paymentReference(entity.getPaymentReference())
                .providerRefundId(entity.getProviderRefundId())
                .status(entity.getStatus())
                .amount(entity.getAmount())
                .currencyCode(entity.getCurrencyCode())
                .failureCode(entity.getFailureCode())
                .message(entity.getFailureMessage())
                .timestamp(entity.getUpdatedAt() != null ? entity.getUpdatedAt() : Instant.now())
                .build();
    }

    private static String truncate(String message) {
        if (message != null && message.length() > 900) {
            return message.substring(0, 900);
        }
        return message;
    }
}
