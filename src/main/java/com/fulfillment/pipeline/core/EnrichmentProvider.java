package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.EnrichmentRequest;

/**
 * Third-party data enrichment used by products that need it before content generation.
 * The orchestrator wraps calls with retry and a per-attempt timeout.
 */
public interface EnrichmentProvider {

    /**
     * Fetch enrichment data for the order's input.
     *
     * @return opaque payload, stored verbatim on the order (never null)
     * @throws RuntimeException on any failure; the caller decides whether to retry
     */
    String fetchEnrichmentData(EnrichmentRequest request);
}
