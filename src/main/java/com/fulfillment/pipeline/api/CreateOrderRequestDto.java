package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.domain.ProductKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.Map;

/**
 * Request body for POST /api/v1/orders, sent by the conversational front-end once the user has
 * answered the product's questions.
 */
@Data
public class CreateOrderRequestDto {

    @NotBlank(message = "userRef is required")
    private String userRef;

    @NotNull(message = "productKind is required")
    private ProductKind productKind;

    /** Answers keyed by field name, e.g. birthday, birth_time, gender. */
    private Map<String, Object> input;

    private String affiliateCode;
}
