package com.flagship.subscription_billing.ledger;

/**
 * Outcome recorded for one charge attempt.
 */
public enum ChargeOutcome {
    SUCCESS,
    FAILED,
    /** The gateway's answer is unknown (timeout, transport error). */
    PENDING;

    public boolean isDeterminate() {
        return this != PENDING;
    }
}
