package com.fulfillment.pipeline.adapters;

import com.fulfillment.pipeline.core.EnrichmentProvider;
import com.fulfillment.pipeline.domain.EnrichmentRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Calls the enrichment API with the order's input and stores its JSON answer verbatim.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fulfillment.adapters.mock.enabled", havingValue = "false")
public class HttpEnrichmentProvider implements EnrichmentProvider {

    private final RestTemplate restTemplate;
    private final String url;

    public HttpEnrichmentProvider(@Qualifier("downstreamRestTemplate") RestTemplate restTemplate,
                                  @Value("${fulfillment.adapters.http.enrichment-url}") String url) {
        this.restTemplate = restTemplate;
        this.url = url;
    }

    @Override
    public String fetchEnrichmentData(EnrichmentRequest request) {
        log.debug("Fetching enrichment data: orderId={}", request.getOrderId());
        String body = restTemplate.postForObject(url, Map.of(
                "order_id", request.getOrderId(),
                "product", request.getProductKind().name(),
                "input", request.getInput()), String.class);
        if (body == null || body.isBlank()) {
            throw new IllegalStateException("Enrichment API returned an empty body");
        }
        return body;
    }
}
