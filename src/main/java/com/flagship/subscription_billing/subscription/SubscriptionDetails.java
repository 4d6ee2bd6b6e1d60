package com.flagship.subscription_billing.subscription;

import com.flagship.subscription_billing.ledger.LedgerEntry;
import lombok.Value;

import java.util.List;

/**
 * A subscription together with its most recent ledger entries, newest first.
 */
@Value
public class SubscriptionDetails {
    Subscription subscription;
    List<LedgerEntry> recentCharges;
}
