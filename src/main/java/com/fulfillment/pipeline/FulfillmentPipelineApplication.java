package com.fulfillment.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the fulfillment pipeline. Enables:
 * <ul>
 *   <li>Signed payment webhooks with per-event deduplication</li>
 *   <li>A versioned order state machine and an asynchronous, resumable fulfillment pipeline</li>
 *   <li>Retry and timeouts per downstream step (Resilience4j), refund compensation on failure</li>
 *   <li>Kafka lifecycle events and REST API docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class FulfillmentPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FulfillmentPipelineApplication.class, args);
    }
}
