package com.fulfillment.pipeline.domain;

/**
 * Compensation progress of an order, tracked next to its status.
 */
public enum RefundState {
    /** No refund needed (yet). */
    NONE,
    /** Pipeline failed after capture; refund about to be or being issued. */
    REQUESTED,
    /** Provider confirmed the refund. */
    COMPLETED,
    /** Refund call failed or its outcome is unknown; an operator must resolve it. */
    PENDING_MANUAL
}
