package com.fulfillment.pipeline.api;

import com.fulfillment.pipeline.core.AffiliateNotFoundException;
import com.fulfillment.pipeline.core.AffiliateService;
import com.fulfillment.pipeline.persistence.entity.AffiliateEntity;
import com.fulfillment.pipeline.persistence.entity.AffiliateLedgerEntryEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AffiliateController.class)
class AffiliateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AffiliateService affiliateService;

    private static AffiliateEntity affiliate() {
        return AffiliateEntity.builder()
                .code("AFF_ABCDEFGH")
                .userRef("promoter-1")
                .totalSales(new BigDecimal("29.99"))
                .totalCommission(new BigDecimal("6.00"))
                .build();
    }

    @Test
    void registerReturnsCodeAndTotals() throws Exception {
        when(affiliateService.register("promoter-1")).thenReturn(affiliate());
        when(affiliateService.ledger("AFF_ABCDEFGH")).thenReturn(List.of());

        mockMvc.perform(post("/api/v1/affiliates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userRef\": \"promoter-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("AFF_ABCDEFGH"))
                .andExpect(jsonPath("$.currentTier").value(1));
    }

    @Test
    void getIncludesLedger() throws Exception {
        when(affiliateService.get("AFF_ABCDEFGH")).thenReturn(affiliate());
        when(affiliateService.ledger("AFF_ABCDEFGH")).thenReturn(List.of(AffiliateLedgerEntryEntity.builder()
                .affiliateCode("AFF_ABCDEFGH")
                .orderId("ORD_1")
                .orderAmount(new BigDecimal("29.99"))
                .commissionRate(new BigDecimal("0.2000"))
                .commissionAmount(new BigDecimal("6.00"))
                .bonusAmount(BigDecimal.ZERO)
                .tier(1)
                .createdAt(Instant.now())
                .build()));

        mockMvc.perform(get("/api/v1/affiliates/AFF_ABCDEFGH"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ledger[0].orderId").value("ORD_1"))
                .andExpect(jsonPath("$.ledger[0].commissionAmount").value(6.00));
    }

    @Test
    void unknownCodeReturns404() throws Exception {
        when(affiliateService.get("AFF_NOPE0000")).thenThrow(new AffiliateNotFoundException("AFF_NOPE0000"));

        mockMvc.perform(get("/api/v1/affiliates/AFF_NOPE0000"))
                .andExpect(status().isNotFound());
    }
}
