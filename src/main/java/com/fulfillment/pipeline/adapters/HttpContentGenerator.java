package com.fulfillment.pipeline.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fulfillment.pipeline.core.ContentGenerator;
import com.fulfillment.pipeline.domain.GenerationRequest;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
@ConditionalOnProperty(name = "fulfillment.adapters.mock.enabled", havingValue = "false")
public class HttpContentGenerator implements ContentGenerator {

    private final RestTemplate restTemplate;
    private final String url;

    public HttpContentGenerator(@Qualifier("downstreamRestTemplate") RestTemplate restTemplate,
                                @Value("${fulfillment.adapters.http.generation-url}") String url) {
        this.restTemplate = restTemplate;
        this.url = url;
    }

    @Override
    public String generateContent(GenerationRequest request) {
        log.debug("Requesting content generation: orderId={}, product={}", request.getOrderId(), request.getProductKind());
        Map<String, Object> body = new HashMap<>();
        body.put("order_id", request.getOrderId());
        body.put("product", request.getProductKind().name());
        body.put("input", request.getInput());
        if (request.getEnrichmentData() != null) {
            body.put("enrichment_data", request.getEnrichmentData());
        }
        GenerationResponse response = restTemplate.postForObject(url, body, GenerationResponse.class);
        JsonNode content = response != null ? response.getContent() : null;
        if (content == null || content.isNull()) {
            throw new IllegalStateException("Generation API response has no content");
        }
        return content.isTextual() ? content.asText() : content.toString();
    }

    /** Content is either a string or a structured report kept as JSON text. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GenerationResponse {
        private JsonNode content;
    }
}
