package com.flagship.subscription_billing.subscription.event;

import com.flagship.subscription_billing.subscription.Subscription;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class SubscriptionCreatedEvent implements SubscriptionEvent {
    UUID eventId;
    UUID subscriptionId;
    UUID userId;
    UUID planId;
    LocalDate firstBillingDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SubscriptionCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SubscriptionCreatedEvent from(Subscription subscription) {
        return new SubscriptionCreatedEvent(
            UUID.randomUUID(),
            subscription.getId(),
            subscription.getUserId(),
            subscription.getPlanId(),
            subscription.getNextBillingDate(),
            subscription.getCreatedAt()
        );
    }
}
