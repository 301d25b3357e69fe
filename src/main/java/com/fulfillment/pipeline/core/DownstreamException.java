package com.fulfillment.pipeline.core;

import lombok.Getter;

/**
 * A pipeline step failed after its retries were exhausted. Never leaves the orchestrator.
 */
@Getter
public class DownstreamException extends RuntimeException {

    private final String step;

    public DownstreamException(String step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }
}
