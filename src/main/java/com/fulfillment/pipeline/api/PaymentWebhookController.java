package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.core.WebhookIngestionService;
import com.fulfillment.pipeline.domain.WebhookOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives payment provider callbacks. The body is taken as raw bytes because the signature covers
 * the exact bytes sent.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Payment provider callbacks")
public class PaymentWebhookController {

    private final WebhookIngestionService ingestionService;

    @PostMapping("/webhooks/payment")
    @Operation(
            summary = "Payment outcome webhook",
            description = "Signed with HMAC-SHA256 over the raw body (hex, in the signature header). "
                    + "Applied, duplicate, stale, ignored and unknown-order events are all acknowledged with 200 so the provider stops retrying.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Acknowledged. Body: { \"status\": \"success\", \"result\": APPLIED|DUPLICATE|STALE|ORDER_NOT_FOUND|IGNORED }"),
            @ApiResponse(responseCode = "400", description = "Signed body is not a usable event. Body: { \"error\": \"MALFORMED_WEBHOOK\", \"message\": ... }"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid signature. Body: { \"error\": \"INVALID_SIGNATURE\", \"message\": ... }"),
            @ApiResponse(responseCode = "500", description = "Not recorded; the provider should retry")
    })
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody(required = false) byte[] rawBody,
            @RequestHeader(name = "${fulfillment.webhook.signature-header:X-Signature}", required = false) String signature) {
        WebhookOutcome outcome = ingestionService.ingest(rawBody != null ? rawBody : new byte[0], signature);
        return ResponseEntity.ok(Map.of("status", "success", "result", outcome.name()));
    }
}
