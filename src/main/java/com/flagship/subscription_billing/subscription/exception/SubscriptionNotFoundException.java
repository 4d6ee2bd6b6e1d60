package com.flagship.subscription_billing.subscription.exception;

import java.util.UUID;

public class SubscriptionNotFoundException extends RuntimeException {

    private final UUID subscriptionId;

    public SubscriptionNotFoundException(UUID subscriptionId) {
        super("Subscription not found: " + subscriptionId);
        this.subscriptionId = subscriptionId;
    }

    public UUID getSubscriptionId() {
        return subscriptionId;
    }
}
