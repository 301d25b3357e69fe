package com.fulfillment.pipeline.domain;

/**
 * Status of a refund call against the payment provider.
 */
public enum RefundStatus {
    /** Recorded before the provider call; still PENDING after a crash means the outcome is unknown. */
    PENDING,
    /** Refund completed successfully. */
    SUCCESS,
    /** Refund failed. */
    FAILED
}
