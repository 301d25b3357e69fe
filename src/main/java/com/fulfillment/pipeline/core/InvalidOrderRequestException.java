package com.fulfillment.pipeline.core;

/**
 * Thrown when an order cannot be created or acted on as requested. Handler returns HTTP 400.
 */
public class InvalidOrderRequestException extends RuntimeException {

    public InvalidOrderRequestException(String message) {
        super(message);
    }

    public InvalidOrderRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
