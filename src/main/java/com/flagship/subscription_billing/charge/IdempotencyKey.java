package com.flagship.subscription_billing.charge;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Identifies one charge attempt: {@code {subscriptionId}:{billingDate}:{attempt}}.
 *
 * {@code attempt} is one more than the FAILED entries already recorded for
 * the billing date. A PENDING outcome does not advance it, so retrying after a
 * timeout sends the same key and the gateway can deduplicate.
 */
@Value
public class IdempotencyKey {
    UUID subscriptionId;
    LocalDate billingDate;
    int attempt;

    public static IdempotencyKey forAttempt(UUID subscriptionId, LocalDate billingDate, int previousFailures) {
        if (previousFailures < 0) {
            throw new IllegalArgumentException("Previous failures cannot be negative: " + previousFailures);
        }
        return new IdempotencyKey(subscriptionId, billingDate, previousFailures + 1);
    }

    public String value() {
        return subscriptionId + ":" + billingDate + ":" + attempt;
    }

    @Override
    public String toString() {
        return value();
    }
}
