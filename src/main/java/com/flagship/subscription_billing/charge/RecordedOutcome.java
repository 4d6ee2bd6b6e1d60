package com.flagship.subscription_billing.charge;

import com.flagship.subscription_billing.ledger.ChargeOutcome;
import com.flagship.subscription_billing.ledger.LedgerEntry;
import lombok.Value;

/**
 * A determinate ledger entry already recorded for an idempotency key.
 */
@Value
public class RecordedOutcome {

    public enum Source {
        CACHE,
        LEDGER
    }

    LedgerEntry entry;
    Source source;

    public ChargeOutcome getOutcome() {
        return entry.getOutcome();
    }
}
