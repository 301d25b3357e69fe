package com.fulfillment.pipeline.adapters;

import com.fulfillment.pipeline.core.ContentGenerator;
import com.fulfillment.pipeline.domain.GenerationRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Local stand-in for the generation backend. Input {@code mock_fail=generation} makes every call
 * fail.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fulfillment.adapters.mock.enabled", havingValue = "true", matchIfMissing = true)
public class MockContentGenerator implements ContentGenerator {

    @Override
    public String generateContent(GenerationRequest request) {
        log.debug("MockContentGenerator generating orderId={} product={}", request.getOrderId(), request.getProductKind());
        if ("generation".equals(request.getInput().get(MockEnrichmentProvider.FAIL_KEY))) {
            throw new IllegalStateException("Simulated generation outage");
        }
        StringBuilder sb = new StringBuilder()
                .append("Your ").append(request.getProductKind().getDisplayName()).append(" report\n\n");
        request.getInput().forEach((key, value) -> sb.append(key).append(": ").append(value).append('\n'));
        if (request.getEnrichmentData() != null) {
            sb.append("\nBased on: ").append(request.getEnrichmentData()).append('\n');
        }
        return sb.toString();
    }
}
