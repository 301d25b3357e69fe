package com.fulfillment.pipeline.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RegisterAffiliateRequestDto {

    @NotBlank(message = "userRef is required")
    private String userRef;
}
