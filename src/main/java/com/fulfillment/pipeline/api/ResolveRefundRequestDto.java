package com.fulfillment.pipeline.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Body of POST /api/v1/admin/orders/{orderId}/refund-resolved.
 */
@Data
public class ResolveRefundRequestDto {

    @NotBlank(message = "operator is required")
    private String operator;

    /** Provider's id of the refund done by hand, if known. */
    private String providerRefundId;
}
