package com.fulfillment.pipeline.adapters;

import com.fulfillment.pipeline.core.EnrichmentProvider;
import com.fulfillment.pipeline.domain.EnrichmentRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Local stand-in for the enrichment API. Input {@code mock_fail=enrichment} makes every call fail.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fulfillment.adapters.mock.enabled", havingValue = "true", matchIfMissing = true)
public class MockEnrichmentProvider implements EnrichmentProvider {

    static final String FAIL_KEY = "mock_fail";

    @Override
    public String fetchEnrichmentData(EnrichmentRequest request) {
        log.debug("MockEnrichmentProvider fetching orderId={}", request.getOrderId());
        if ("enrichment".equals(request.getInput().get(FAIL_KEY))) {
            throw new IllegalStateException("Simulated enrichment outage");
        }
        Object birthday = request.getInput().get("birthday");
        Object birthTime = request.getInput().get("birth_time");
        return "{\"source\":\"mock\",\"birthday\":\"" + birthday + "\",\"birth_time\":\"" + birthTime
                + "\",\"pillars\":[\"year\",\"month\",\"day\",\"hour\"]}";
    }
}
