package com.flagship.subscription_billing.subscription;

/**
 * Lifecycle status of a subscription.
 *
 * ACTIVE and PAST_DUE subscriptions are picked up by billing runs.
 * CANCELLED is terminal.
 */
public enum SubscriptionStatus {
    ACTIVE,
    PAST_DUE,
    CANCELLED;

    public boolean isBillable() {
        return this != CANCELLED;
    }

    public boolean isTerminal() {
        return this == CANCELLED;
    }
}
