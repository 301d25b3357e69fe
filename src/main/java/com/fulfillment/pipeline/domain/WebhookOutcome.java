package com.fulfillment.pipeline.domain;

/**
 * What the ingress did with one webhook delivery. Everything except a rejection is acknowledged
 * to the provider with a success status.
 */
public enum WebhookOutcome {
    APPLIED,
    DUPLICATE,
    STALE,
    ORDER_NOT_FOUND,
    /** Verified, but carries a status or amount this service does not act on. */
    IGNORED
}
