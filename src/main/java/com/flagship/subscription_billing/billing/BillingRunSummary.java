package com.flagship.subscription_billing.billing;

import lombok.Value;

/**
 * Counts for one billing run.
 *
 * {@code considered} always equals the sum of the other counts: every due
 * subscription a run picked up ends in exactly one bucket.
 */
@Value
public class BillingRunSummary {
    int considered;
    int processed;
    int failed;
    int escalatedToCancelled;
    int indeterminate;
    int conflicts;
    int storageErrors;
    int deferred;
    BillingRunStatus status;

    public static BillingRunSummary empty(BillingRunStatus status) {
        return new BillingRunSummary(0, 0, 0, 0, 0, 0, 0, 0, status);
    }

    /**
     * Mutable counter owned by the thread coordinating a run.
     */
    static final class Tally {
        private int processed;
        private int failed;
        private int escalatedToCancelled;
        private int indeterminate;
        private int conflicts;
        private int storageErrors;
        private int deferred;

        void record(AttemptOutcome outcome) {
            switch (outcome) {
                case PROCESSED -> processed++;
                case FAILED -> failed++;
                case ESCALATED_TO_CANCELLED -> escalatedToCancelled++;
                case INDETERMINATE -> indeterminate++;
                case CONFLICT -> conflicts++;
                case STORAGE_ERROR -> storageErrors++;
            }
        }

        void defer(int count) {
            deferred += count;
        }

        int considered() {
            return processed + failed + escalatedToCancelled + indeterminate + conflicts + storageErrors + deferred;
        }

        BillingRunSummary toSummary(BillingRunStatus status) {
            return new BillingRunSummary(considered(), processed, failed, escalatedToCancelled,
                    indeterminate, conflicts, storageErrors, deferred, status);
        }
    }
}
