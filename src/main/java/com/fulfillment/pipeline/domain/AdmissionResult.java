package com.fulfillment.pipeline.domain;

public enum AdmissionResult {
    ACCEPTED,
    DUPLICATE
}
