package com.fulfillment.pipeline.core;

/**
 * Thrown when a webhook body does not carry a valid signature. The body must not be parsed.
 * Handler returns HTTP 401.
 */
public class InvalidSignatureException extends RuntimeException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
