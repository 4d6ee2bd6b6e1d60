package com.flagship.subscription_billing.subscription;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Current state of one subscription.
 *
 * {@code userId}, {@code planId} and {@code createdAt} never change after
 * creation. {@code version} is bumped by every write and guards conditional
 * updates from billing attempts.
 */
@Value
public class Subscription {
    UUID id;
    UUID userId;
    UUID planId;
    SubscriptionStatus status;
    LocalDate nextBillingDate;
    Instant createdAt;
    Instant cancelledAt;
    long version;

    /**
     * A new ACTIVE subscription whose first charge is due on {@code firstBillingDate}.
     */
    public static Subscription open(UUID userId, UUID planId, LocalDate firstBillingDate, Instant createdAt) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID cannot be null");
        }
        if (planId == null) {
            throw new IllegalArgumentException("Plan ID cannot be null");
        }
        if (firstBillingDate == null) {
            throw new IllegalArgumentException("First billing date cannot be null");
        }
        return new Subscription(
            UUID.randomUUID(),
            userId,
            planId,
            SubscriptionStatus.ACTIVE,
            firstBillingDate,
            createdAt,
            null,
            0L
        );
    }

    public boolean isBillable() {
        return status.isBillable();
    }

    public boolean isDueOn(LocalDate asOf) {
        return isBillable() && !nextBillingDate.isAfter(asOf);
    }
}
