package com.flagship.subscription_billing.subscription.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SubscriptionCancelledEvent implements SubscriptionEvent {
    UUID eventId;
    UUID subscriptionId;
    Reason reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SubscriptionCancelled";

    public enum Reason {
        USER_REQUESTED,
        PAYMENT_FAILURES
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SubscriptionCancelledEvent of(UUID subscriptionId, Reason reason, Instant occurredAt) {
        return new SubscriptionCancelledEvent(UUID.randomUUID(), subscriptionId, reason, occurredAt);
    }
}
