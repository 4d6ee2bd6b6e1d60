package com.flagship.subscription_billing.subscription.exception;

import java.util.UUID;

/**
 * A conditional update lost: the subscription changed since it was read,
 * or it has been cancelled.
 */
public class StaleSubscriptionException extends RuntimeException {

    private final UUID subscriptionId;
    private final long expectedVersion;

    public StaleSubscriptionException(UUID subscriptionId, long expectedVersion) {
        super(String.format("Subscription %s changed concurrently (expected version %d)",
                subscriptionId, expectedVersion));
        this.subscriptionId = subscriptionId;
        this.expectedVersion = expectedVersion;
    }

    public UUID getSubscriptionId() {
        return subscriptionId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
