package com.fulfillment.pipeline.core;

public class AffiliateNotFoundException extends RuntimeException {

    public AffiliateNotFoundException(String code) {
        super("Affiliate not found: " + code);
    }
}
