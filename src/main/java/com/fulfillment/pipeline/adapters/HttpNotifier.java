package com.fulfillment.pipeline.adapters;

import com.fulfillment.pipeline.core.Notifier;
import com.fulfillment.pipeline.domain.DeliveryStatus;
import com.fulfillment.pipeline.domain.MessageKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;
import java.util.Map;

/**
 * Posts user messages to the messaging gateway that fronts the chat channel.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fulfillment.adapters.mock.enabled", havingValue = "false")
public class HttpNotifier implements Notifier {

    private final RestTemplate restTemplate;
    private final String url;

    public HttpNotifier(@Qualifier("downstreamRestTemplate") RestTemplate restTemplate,
                        @Value("${fulfillment.adapters.http.notifier-url}") String url) {
        this.restTemplate = restTemplate;
        this.url = url;
    }

    @Override
    public DeliveryStatus notify(String userRef, MessageKind kind, String payload) {
        try {
            ResponseEntity<Void> response = restTemplate.postForEntity(url, Map.of(
                    "user_ref", userRef,
                    "kind", kind.name().toLowerCase(Locale.ROOT),
                    "text", payload != null ? payload : ""), Void.class);
            return response.getStatusCode().is2xxSuccessful() ? DeliveryStatus.DELIVERED : DeliveryStatus.FAILED;
        } catch (RestClientException e) {
            log.warn("Message delivery failed: kind={}, error={}", kind, e.getMessage());
            return DeliveryStatus.FAILED;
        }
    }
}
