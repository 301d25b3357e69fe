package com.fulfillment.pipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Input of the content-generation call. {@code enrichmentData} is null for products that skip
 * enrichment.
 */
@Value
@Builder
public class GenerationRequest {

    String orderId;
    ProductKind productKind;
    Map<String, Object> input;
    String enrichmentData;
}
