package com.flagship.subscription_billing.subscription.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a subscription's lifecycle, published through the outbox.
 */
public interface SubscriptionEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getSubscriptionId();

    Instant getOccurredAt();

    String getEventType();
}
