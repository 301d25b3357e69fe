package com.fulfillment.pipeline.core;

/**
 * Thrown when an authenticated webhook body cannot be parsed or lacks required fields.
 */
public class MalformedWebhookException extends RuntimeException {

    public MalformedWebhookException(String message) {
        super(message);
    }

    public MalformedWebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
