package com.flagship.subscription_billing.config;

import lombok.Getter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings for billing cycle runs, bound from {@code billing.cycle.*}.
 *
 * Immutable: every component that needs a value receives this object at
 * construction instead of reading globals.
 */
@ConfigurationProperties(prefix = "billing.cycle")
@Getter
@ToString
public class BillingProperties {

    /** Due subscriptions fetched per page. */
    private final int batchSize;

    /** Upper bound on charge attempts in flight at once. */
    private final int concurrency;

    /** Wall-clock budget for one run; no new attempts start after it elapses. */
    private final Duration runTimeout;

    /** Consecutive FAILED entries that cancel a PAST_DUE subscription. 0 disables. */
    private final int escalationThreshold;

    /** Ledger entries attached to each subscription in list responses. */
    private final int historyLimit;

    public BillingProperties(@DefaultValue("100") int batchSize,
                             @DefaultValue("8") int concurrency,
                             @DefaultValue("30m") Duration runTimeout,
                             @DefaultValue("3") int escalationThreshold,
                             @DefaultValue("5") int historyLimit) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("billing.cycle.batch-size must be positive: " + batchSize);
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("billing.cycle.concurrency must be positive: " + concurrency);
        }
        if (runTimeout == null || runTimeout.isNegative() || runTimeout.isZero()) {
            throw new IllegalArgumentException("billing.cycle.run-timeout must be positive: " + runTimeout);
        }
        if (escalationThreshold < 0) {
            throw new IllegalArgumentException(
                "billing.cycle.escalation-threshold cannot be negative: " + escalationThreshold);
        }
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("billing.cycle.history-limit must be positive: " + historyLimit);
        }
        this.batchSize = batchSize;
        this.concurrency = concurrency;
        this.runTimeout = runTimeout;
        this.escalationThreshold = escalationThreshold;
        this.historyLimit = historyLimit;
    }
}
