package com.fulfillment.pipeline.core;

public class DownstreamTimeoutException extends DownstreamException {

    public DownstreamTimeoutException(String step, String message, Throwable cause) {
        super(step, message, cause);
    }
}
