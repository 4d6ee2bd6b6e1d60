package com.flagship.subscription_billing.billing;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Record of one billing pass. The summary counts are zero while the run is
 * RUNNING and when it FAILED before finishing.
 */
@Value
public class BillingRun {
    UUID id;
    BillingRunTrigger trigger;
    LocalDate asOf;
    BillingRunStatus status;
    BillingRunSummary summary;
    Instant startedAt;
    Instant completedAt;
    String errorDetails;

    public static BillingRun start(BillingRunTrigger trigger, LocalDate asOf, Instant startedAt) {
        return new BillingRun(
            UUID.randomUUID(),
            trigger,
            asOf,
            BillingRunStatus.RUNNING,
            BillingRunSummary.empty(BillingRunStatus.RUNNING),
            startedAt,
            null,
            null
        );
    }
}
