package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.DeliveryStatus;
import com.fulfillment.pipeline.domain.MessageKind;

/**
 * Outbound channel to the end user. Implementations report failure through the return value or by
 * throwing; {@link NotificationService} treats both the same way.
 */
public interface Notifier {

    DeliveryStatus notify(String userRef, MessageKind kind, String payload);
}
