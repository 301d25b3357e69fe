package com.fulfillment.pipeline.adapters;

import com.fulfillment.pipeline.core.Notifier;
import com.fulfillment.pipeline.domain.DeliveryStatus;
import com.fulfillment.pipeline.domain.MessageKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(name = "fulfillment.adapters.mock.enabled", havingValue = "true", matchIfMissing = true)
public class MockNotifier implements Notifier {

    @Override
    public DeliveryStatus notify(String userRef, MessageKind kind, String payload) {
        log.info("MockNotifier -> user={} kind={} length={}", userRef, kind, payload != null ? payload.length() : 0);
        return DeliveryStatus.DELIVERED;
    }
}
