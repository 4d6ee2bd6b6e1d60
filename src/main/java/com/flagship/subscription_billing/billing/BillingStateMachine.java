package com.flagship.subscription_billing.billing;

import com.flagship.subscription_billing.catalog.BillingCycle;
import com.flagship.subscription_billing.ledger.ChargeOutcome;
import com.flagship.subscription_billing.subscription.SubscriptionStatus;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Subscription lifecycle rules. Pure: no I/O, no clock, no state.
 *
 * <pre>
 * ACTIVE    + SUCCESS -> ACTIVE,    date + one period
 * ACTIVE    + FAILED  -> PAST_DUE,  date unchanged
 * PAST_DUE  + SUCCESS -> ACTIVE,    date + one period
 * PAST_DUE  + FAILED  -> PAST_DUE,  date unchanged
 * CANCELLED + any     -> CANCELLED, date unchanged
 * any       + PENDING -> unchanged
 * </pre>
 *
 * The period is added to the billed date, never to "today", so a late run
 * does not shift a subscription's billing anchor.
 */
@Component
public class BillingStateMachine {

    public Transition transition(SubscriptionStatus current, ChargeOutcome outcome,
                                 LocalDate currentNextBillingDate, BillingCycle cycle) {
        if (current == null || outcome == null || currentNextBillingDate == null || cycle == null) {
            throw new IllegalArgumentException("Status, outcome, billing date and cycle are required");
        }

        if (current.isTerminal() || outcome == ChargeOutcome.PENDING) {
            return Transition.to(current, currentNextBillingDate);
        }

        return switch (outcome) {
            case SUCCESS -> Transition.to(SubscriptionStatus.ACTIVE, cycle.advance(currentNextBillingDate));
            case FAILED -> Transition.to(SubscriptionStatus.PAST_DUE, currentNextBillingDate);
            case PENDING -> Transition.to(current, currentNextBillingDate);
        };
    }

    /**
     * Cancels a PAST_DUE target once {@code consecutiveFailures} reaches
     * {@code threshold}. A threshold of zero disables escalation.
     */
    public Transition escalate(Transition target, int consecutiveFailures, int threshold) {
        if (threshold <= 0
                || target.getStatus() != SubscriptionStatus.PAST_DUE
                || consecutiveFailures < threshold) {
            return target;
        }
        return new Transition(SubscriptionStatus.CANCELLED, target.getNextBillingDate(), true);
    }
}
