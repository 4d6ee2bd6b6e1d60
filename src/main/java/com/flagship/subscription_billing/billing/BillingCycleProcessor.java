package com.flagship.subscription_billing.billing;

import com.flagship.subscription_billing.config.BillingExecutorConfig;
import com.flagship.subscription_billing.config.BillingProperties;
import com.flagship.subscription_billing.observability.CorrelationContext;
import com.flagship.subscription_billing.subscription.DueCursor;
import com.flagship.subscription_billing.subscription.Subscription;
import com.flagship.subscription_billing.subscription.SubscriptionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Drives one billing pass over every subscription due on a date.
 *
 * Batches are fetched one at a time by the calling thread, ordered by
 * billing date then id, each batch starting after the last subscription of
 * the previous one. Within a batch, attempts run on the shared worker pool,
 * at most {@code billing.cycle.concurrency} at a time for this run. A run
 * attempts each subscription at most once, even if a renewal leaves it due
 * again on the same date.
 *
 * When the run is cancelled or its deadline passes, no further attempts are
 * dispatched; the rest of the current batch is counted as deferred and stays
 * due for the next run. Attempts in flight are always awaited.
 *
 * Per-subscription errors are counted, never thrown. A failure to fetch a
 * batch aborts the run and propagates to the caller.
 */
@Component
@Slf4j
public class BillingCycleProcessor {

    private static final long PERMIT_POLL_MS = 100;

    private final SubscriptionStore subscriptionStore;
    private final BillingAttemptService attemptService;
    private final ExecutorService workerPool;
    private final BillingProperties properties;

    public BillingCycleProcessor(SubscriptionStore subscriptionStore,
                                 BillingAttemptService attemptService,
                                 @Qualifier(BillingExecutorConfig.BILLING_WORKER_POOL) ExecutorService workerPool,
                                 BillingProperties properties) {
        this.subscriptionStore = subscriptionStore;
        this.attemptService = attemptService;
        this.workerPool = workerPool;
        this.properties = properties;
    }

    public BillingRunSummary run(LocalDate asOf, BillingRunControl control) {
        if (asOf == null) {
            throw new IllegalArgumentException("as-of date is required");
        }

        BillingRunSummary.Tally tally = new BillingRunSummary.Tally();
        Set<UUID> attempted = new HashSet<>();
        Semaphore permits = new Semaphore(properties.getConcurrency());
        BillingRunStatus status = BillingRunStatus.COMPLETED;
        DueCursor cursor = null;
        int batchNumber = 0;

        while (true) {
            if (control.shouldStop()) {
                status = control.stopStatus();
                break;
            }

            List<Subscription> batch = cursor == null
                    ? subscriptionStore.findDue(asOf, properties.getBatchSize())
                    : subscriptionStore.findDueAfter(asOf, cursor, properties.getBatchSize());
            if (batch.isEmpty()) {
                break;
            }
            batchNumber++;
            cursor = DueCursor.after(batch.get(batch.size() - 1));

            List<Subscription> fresh = batch.stream()
                    .filter(subscription -> attempted.add(subscription.getId()))
                    .collect(Collectors.toList());

            log.info("Processing batch {}: fetched={}, new={}, asOf={}",
                    batchNumber, batch.size(), fresh.size(), asOf);
            processBatch(fresh, permits, control, tally);
        }

        BillingRunSummary summary = tally.toSummary(status);
        log.info("Billing pass finished: asOf={}, batches={}, summary={}", asOf, batchNumber, summary);
        return summary;
    }

    private void processBatch(List<Subscription> batch, Semaphore permits,
                              BillingRunControl control, BillingRunSummary.Tally tally) {
        List<CompletableFuture<AttemptResult>> inFlight = new ArrayList<>(batch.size());
        int deferred = 0;

        for (int i = 0; i < batch.size(); i++) {
            if (!acquirePermit(permits, control)) {
                deferred = batch.size() - i;
                break;
            }
            Subscription subscription = batch.get(i);
            try {
                inFlight.add(CompletableFuture.supplyAsync(
                        CorrelationContext.withCallerContext(() -> attemptAndRelease(subscription, permits)),
                        workerPool));
            } catch (RejectedExecutionException e) {
                permits.release();
                log.warn("Worker pool rejected billing attempt, deferring rest of batch: {}", e.getMessage());
                deferred = batch.size() - i;
                break;
            }
        }

        if (deferred > 0) {
            log.warn("Run stopping: {} due subscriptions deferred to the next run", deferred);
            tally.defer(deferred);
        }

        for (CompletableFuture<AttemptResult> future : inFlight) {
            try {
                tally.record(future.join().getOutcome());
            } catch (CompletionException | CancellationException e) {
                log.error("Billing attempt failed unexpectedly", e);
                tally.record(AttemptOutcome.STORAGE_ERROR);
            }
        }
    }

    private AttemptResult attemptAndRelease(Subscription subscription, Semaphore permits) {
        try {
            return attemptService.attempt(subscription);
        } finally {
            permits.release();
        }
    }

    /**
     * Waits for a free slot, giving up as soon as the run should stop.
     */
    private boolean acquirePermit(Semaphore permits, BillingRunControl control) {
        try {
            while (!control.shouldStop()) {
                long waitMs = Math.max(1, Math.min(PERMIT_POLL_MS, control.remaining().toMillis()));
                if (permits.tryAcquire(waitMs, TimeUnit.MILLISECONDS)) {
                    if (control.shouldStop()) {
                        permits.release();
                        return false;
                    }
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            control.cancel();
            return false;
        }
    }
}
