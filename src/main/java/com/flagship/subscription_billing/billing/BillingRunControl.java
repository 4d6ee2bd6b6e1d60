package com.flagship.subscription_billing.billing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop signal for one billing run: a deadline plus a cancel flag.
 *
 * Stopping only prevents new attempts from being dispatched. Attempts already
 * in flight always run to completion.
 */
public final class BillingRunControl {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private BillingRunControl(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static BillingRunControl withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Run timeout must not be negative: " + timeout);
        }
        return new BillingRunControl(clock, clock.instant().plus(timeout));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isPastDeadline() {
        return !clock.instant().isBefore(deadline);
    }

    public boolean shouldStop() {
        return isCancelled() || isPastDeadline();
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * CANCELLED wins over TIMED_OUT when both apply.
     */
    public BillingRunStatus stopStatus() {
        if (isCancelled()) {
            return BillingRunStatus.CANCELLED;
        }
        return isPastDeadline() ? BillingRunStatus.TIMED_OUT : BillingRunStatus.COMPLETED;
    }
}
