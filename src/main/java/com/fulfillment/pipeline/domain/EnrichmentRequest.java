package com.fulfillment.pipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class EnrichmentRequest {

    String orderId;
    ProductKind productKind;
    Map<String, Object> input;
}
