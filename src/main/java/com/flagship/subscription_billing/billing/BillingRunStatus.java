package com.flagship.subscription_billing.billing;

public enum BillingRunStatus {
    RUNNING,
    /** Every due subscription was considered. */
    COMPLETED,
    /** The run timeout elapsed; some due subscriptions were deferred. */
    TIMED_OUT,
    /** Stopped on request; some due subscriptions were deferred. */
    CANCELLED,
    /** Aborted by a coordinating-level error such as a failed batch fetch. */
    FAILED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
