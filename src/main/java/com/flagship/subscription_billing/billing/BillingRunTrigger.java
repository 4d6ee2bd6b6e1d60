package com.flagship.subscription_billing.billing;

public enum BillingRunTrigger {
    API,
    SCHEDULER
}
