package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.GenerationRequest;

/**
 * Content generation backend. Calls are not assumed to be idempotent: the orchestrator never calls
 * it for an order that already has generated content.
 */
public interface ContentGenerator {

    /**
     * @return the generated report text (never null or blank)
     * @throws RuntimeException on any failure
     */
    String generateContent(GenerationRequest request);
}
