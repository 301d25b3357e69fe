package com.fulfillment.pipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CreateOrderCommand {

    String userRef;
    ProductKind productKind;
    Map<String, Object> input;
    /** Optional referring affiliate. */
    String affiliateCode;
}
