package com.fulfillment.pipeline.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Sellable report variants. The price is fixed per kind and becomes the order amount; only
 * {@link #BIRTH_CHART} needs the enrichment step before content generation.
 */
public enum ProductKind {

    DAILY_TAROT("Daily Tarot Draw", "0.00", false, List.of()),
    WEEKLY_HOROSCOPE("Weekly Horoscope", "4.99", false, List.of("zodiac")),
    NAME_INTERPRETATION("Name Interpretation", "9.99", false, List.of("name")),
    COMPATIBILITY_TEST("Compatibility Test", "9.99", false, List.of("zodiac_a", "zodiac_b")),
    BIRTH_CHART("Birth Bazi Chart", "29.99", true, List.of("birthday", "birth_time", "gender")),
    ANNUAL_FORECAST("Annual Forecast", "19.99", false, List.of("birthday", "gender"));

    private final String displayName;
    private final BigDecimal price;
    private final boolean requiresEnrichment;
    private final List<String> requiredInputFields;

    ProductKind(String displayName, String price, boolean requiresEnrichment, List<String> requiredInputFields) {
        this.displayName = displayName;
        this.price = new BigDecimal(price);
        this.requiresEnrichment = requiresEnrichment;
        this.requiredInputFields = requiredInputFields;
    }

    public String getDisplayName() {
        return displayName;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public boolean requiresEnrichment() {
        return requiresEnrichment;
    }

    public List<String> getRequiredInputFields() {
        return requiredInputFields;
    }
}
