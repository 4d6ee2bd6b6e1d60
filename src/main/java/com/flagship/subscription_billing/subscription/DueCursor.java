package com.flagship.subscription_billing.subscription;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Keyset position in the due-subscription ordering {@code (nextBillingDate, id)}.
 */
@Value
public class DueCursor {
    LocalDate nextBillingDate;
    UUID id;

    public static DueCursor after(Subscription subscription) {
        return new DueCursor(subscription.getNextBillingDate(), subscription.getId());
    }
}
