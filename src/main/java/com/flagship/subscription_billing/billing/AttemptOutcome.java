package com.flagship.subscription_billing.billing;

/**
 * How a single billing attempt ended, from the run's point of view.
 */
public enum AttemptOutcome {
    /** Charged successfully and renewed. */
    PROCESSED,
    /** Declined; subscription is PAST_DUE. */
    FAILED,
    /** Declined and cancelled by the escalation policy. */
    ESCALATED_TO_CANCELLED,
    /** Gateway outcome unknown; PENDING entry written, subscription untouched. */
    INDETERMINATE,
    /** Lost a race with another writer, or the subscription vanished. */
    CONFLICT,
    /** Ledger or store write failed. */
    STORAGE_ERROR
}
