package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.core.AffiliateService;
import com.fulfillment.pipeline.persistence.entity.AffiliateEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/affiliates")
@RequiredArgsConstructor
@Tag(name = "Affiliates", description = "Affiliate registration and commission ledger")
public class AffiliateController {

    private final AffiliateService affiliateService;

    @PostMapping
    @Operation(summary = "Register affiliate", description = "Idempotent per user: returns the existing code if the user is already an affiliate.")
    public ResponseEntity<AffiliateResponseDto> register(@Valid @RequestBody RegisterAffiliateRequestDto dto) {
        AffiliateEntity affiliate = affiliateService.register(dto.getUserRef());
        return ResponseEntity.ok(AffiliateResponseDto.from(affiliate, affiliateService.ledger(affiliate.getCode())));
    }

    @GetMapping("/{code}")
    @Operation(summary = "Affiliate totals and ledger")
    public ResponseEntity<AffiliateResponseDto> get(@PathVariable String code) {
        AffiliateEntity affiliate = affiliateService.get(code);
        return ResponseEntity.ok(AffiliateResponseDto.from(affiliate, affiliateService.ledger(code)));
    }
}
