package com.flagship.subscription_billing.billing;

import com.flagship.subscription_billing.subscription.Subscription;
import lombok.Value;

import java.util.UUID;

@Value
public class AttemptResult {
    UUID subscriptionId;
    AttemptOutcome outcome;
    /** State after the attempt; the state as read when nothing was written. */
    Subscription subscription;
    UUID ledgerEntryId;
    boolean replayed;
    String detail;

    public static AttemptResult of(Subscription subscription, AttemptOutcome outcome, UUID ledgerEntryId,
                                   boolean replayed, String detail) {
        return new AttemptResult(subscription.getId(), outcome, subscription, ledgerEntryId, replayed, detail);
    }
}
