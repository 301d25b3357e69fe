package com.fulfillment.pipeline.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fulfillment.pipeline.core.PaymentProviderClient;
import com.fulfillment.pipeline.core.SignatureVerifier;
import com.fulfillment.pipeline.domain.RefundRequest;
import com.fulfillment.pipeline.domain.RefundResult;
import com.fulfillment.pipeline.domain.RefundStatus;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Refund API of the payment provider. Requests are signed with the shared secret and carry the
 * refund key as idempotency key. Any transport error is reported as a failed refund; the caller
 * never retries it automatically because the provider may have processed the request.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fulfillment.adapters.mock.enabled", havingValue = "false")
public class HttpPaymentProviderClient implements PaymentProviderClient {

    private final RestTemplate restTemplate;
    private final SignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final String url;
    private final String secret;
    private final String signatureHeader;

    public HttpPaymentProviderClient(@Qualifier("downstreamRestTemplate") RestTemplate restTemplate,
                                     SignatureVerifier signatureVerifier,
                                     ObjectMapper objectMapper,
                                     @Value("${fulfillment.adapters.http.refund-url}") String url,
                                     @Value("${fulfillment.webhook.secret}") String secret,
                                     @Value("${fulfillment.webhook.signature-header:X-Signature}") String signatureHeader) {
        this.restTemplate = restTemplate;
        this.signatureVerifier = signatureVerifier;
        this.objectMapper = objectMapper;
        this.url = url;
        this.secret = secret;
        this.signatureHeader = signatureHeader;
    }

    @Override
    public RefundResult issueRefund(RefundRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("refund_key", request.getIdempotencyKey());
        body.put("payment_reference", request.getPaymentReference());
        body.put("amount", request.getAmount().toPlainString());
        body.put("currency", request.getCurrencyCode());
        body.put("reason", request.getReason());

        try {
            String json = objectMapper.writeValueAsString(body);
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.set("Idempotency-Key", request.getIdempotencyKey());
            headers.set(signatureHeader, signatureVerifier.sign(json, secret));

            RefundResponse response = restTemplate.postForObject(url, new HttpEntity<>(json, headers), RefundResponse.class);
            String status = response != null ? response.getStatus() : null;
            boolean succeeded = "succeeded".equalsIgnoreCase(status) || "success".equalsIgnoreCase(status);
            return RefundResult.builder()
                    .idempotencyKey(request.getIdempotencyKey())
                    .paymentReference(request.getPaymentReference())
                    .providerRefundId(response != null ? response.getRefundId() : null)
                    .status(succeeded ? RefundStatus.SUCCESS : RefundStatus.FAILED)
                    .amount(request.getAmount())
                    .currencyCode(request.getCurrencyCode())
                    .failureCode(succeeded ? null : "PROVIDER_" + status)
                    .message(response != null ? response.getMessage() : null)
                    .timestamp(Instant.now())
                    .build();
        } catch (JsonProcessingException | RestClientException e) {
            log.error("Refund request failed: refundKey={}", request.getIdempotencyKey(), e);
            return RefundResult.builder()
                    .idempotencyKey(request.getIdempotencyKey())
                    .paymentReference(request.getPaymentReference())
                    .status(RefundStatus.FAILED)
                    .amount(request.getAmount())
                    .currencyCode(request.getCurrencyCode())
                    .failureCode("PROVIDER_UNREACHABLE")
                    .message(e.getMessage())
                    .timestamp(Instant.now())
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RefundResponse {
        private String status;
        @JsonProperty("refund_id")
        private String refundId;
        private String message;
    }
}
