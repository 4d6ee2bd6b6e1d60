package com.flagship.subscription_billing.billing;

import com.flagship.subscription_billing.subscription.SubscriptionStatus;
import lombok.Value;

import java.time.LocalDate;

/**
 * Target state computed for a subscription after a charge attempt.
 */
@Value
public class Transition {
    SubscriptionStatus status;
    LocalDate nextBillingDate;
    boolean escalated;

    public static Transition to(SubscriptionStatus status, LocalDate nextBillingDate) {
        return new Transition(status, nextBillingDate, false);
    }
}
