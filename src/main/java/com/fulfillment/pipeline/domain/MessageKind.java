package com.fulfillment.pipeline.domain;

/**
 * User-facing message kinds the notifier can deliver.
 */
public enum MessageKind {
    PAYMENT_ACK(true),
    REPORT_READY(true),
    FAILURE(false),
    REFUND_DONE(false);

    private final boolean retried;

    MessageKind(boolean retried) {
        this.retried = retried;
    }

    /** Delivered under the notification retry policy. */
    public boolean isRetried() {
        return retried;
    }
}
