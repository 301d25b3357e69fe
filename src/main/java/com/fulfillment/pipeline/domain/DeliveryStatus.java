package com.fulfillment.pipeline.domain;

public enum DeliveryStatus {
    DELIVERED,
    FAILED
}
