package com.flagship.subscription_billing.catalog;

import java.time.LocalDate;

/**
 * Length of one billing period.
 *
 * Periods are added with calendar arithmetic to the previous billing date.
 * Month and year steps clamp to the last valid day, so a subscription billed
 * on Jan 31 is next billed on Feb 28 (or 29) and stays on that day afterwards.
 */
public enum BillingCycle {
    WEEKLY,
    MONTHLY,
    YEARLY;

    public LocalDate advance(LocalDate billingDate) {
        if (billingDate == null) {
            throw new IllegalArgumentException("Billing date cannot be null");
        }
        return switch (this) {
            case WEEKLY -> billingDate.plusWeeks(1);
            case MONTHLY -> billingDate.plusMonths(1);
            case YEARLY -> billingDate.plusYears(1);
        };
    }
}
