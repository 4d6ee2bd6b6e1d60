package com.flagship.subscription_billing.support;

import com.flagship.subscription_billing.ledger.ChargeOutcome;
import com.flagship.subscription_billing.ledger.DuplicateChargeAttemptException;
import com.flagship.subscription_billing.ledger.Ledger;
import com.flagship.subscription_billing.ledger.LedgerEntry;
import com.flagship.subscription_billing.ledger.LedgerHistory;
import com.flagship.subscription_billing.ledger.LedgerWriteException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Append-only ledger held in memory, enforcing the same uniqueness rules as
 * the database: one determinate entry per idempotency key and one SUCCESS
 * per subscription and billing date.
 */
public class InMemoryLedger implements Ledger {

    private final List<LedgerEntry> entries = new ArrayList<>();
    private long nextSequence = 1;
    private volatile boolean failAppends;

    public void failAppends(boolean fail) {
        this.failAppends = fail;
    }

    /** Appends an entry directly, bypassing the failure switch. */
    public synchronized void seed(LedgerEntry entry) {
        entries.add(withSequence(entry));
    }

    public synchronized List<LedgerEntry> entries() {
        return new ArrayList<>(entries);
    }

    public synchronized List<LedgerEntry> entriesFor(UUID subscriptionId) {
        return entries.stream()
            .filter(e -> e.getSubscriptionId().equals(subscriptionId))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized UUID append(LedgerEntry entry) {
        if (failAppends) {
            throw new LedgerWriteException("Failed to append ledger entry " + entry.getId(), null);
        }
        if (entry.getOutcome().isDeterminate()) {
            boolean keyTaken = entries.stream().anyMatch(e ->
                e.getOutcome().isDeterminate() && e.getIdempotencyKey().equals(entry.getIdempotencyKey()));
            boolean dateAlreadyPaid = entry.getOutcome() == ChargeOutcome.SUCCESS && entries.stream().anyMatch(e ->
                e.getOutcome() == ChargeOutcome.SUCCESS
                    && e.getSubscriptionId().equals(entry.getSubscriptionId())
                    && e.getBillingDate().equals(entry.getBillingDate()));
            if (keyTaken || dateAlreadyPaid) {
                throw new DuplicateChargeAttemptException(entry.getIdempotencyKey(), null);
            }
        }
        entries.add(withSequence(entry));
        return entry.getId();
    }

    private LedgerEntry withSequence(LedgerEntry entry) {
        return new LedgerEntry(
            entry.getId(), nextSequence++, entry.getSubscriptionId(), entry.getAmount(), entry.getOutcome(),
            entry.getBillingDate(), entry.getIdempotencyKey(), entry.getGatewayTransactionId(),
            entry.getFailureReason(), entry.getProcessedAt());
    }

    @Override
    public LedgerHistory history(UUID subscriptionId, int limit) {
        return new LedgerHistory((beforeSequence, pageSize) -> page(subscriptionId, beforeSequence, pageSize), limit);
    }

    private synchronized List<LedgerEntry> page(UUID subscriptionId, Long beforeSequence, int pageSize) {
        return entries.stream()
            .filter(e -> e.getSubscriptionId().equals(subscriptionId))
            .filter(e -> beforeSequence == null || e.getSequenceNumber() < beforeSequence)
            .sorted(Comparator.comparing(LedgerEntry::getSequenceNumber).reversed())
            .limit(pageSize)
            .collect(Collectors.toList());
    }

    @Override
    public Map<UUID, List<LedgerEntry>> recentHistory(Collection<UUID> subscriptionIds, int perSubscription) {
        return subscriptionIds.stream()
            .distinct()
            .collect(Collectors.toMap(Function.identity(), id -> page(id, null, perSubscription)));
    }

    @Override
    public synchronized Optional<LedgerEntry> findDeterminateByIdempotencyKey(String idempotencyKey) {
        return entries.stream()
            .filter(e -> e.getOutcome().isDeterminate() && e.getIdempotencyKey().equals(idempotencyKey))
            .findFirst();
    }

    @Override
    public synchronized int countFailedAttempts(UUID subscriptionId, LocalDate billingDate) {
        return (int) entries.stream()
            .filter(e -> e.getSubscriptionId().equals(subscriptionId)
                && e.getBillingDate().equals(billingDate)
                && e.getOutcome() == ChargeOutcome.FAILED)
            .count();
    }

    @Override
    public synchronized int countConsecutiveFailures(UUID subscriptionId) {
        int failures = 0;
        for (int i = entries.size() - 1; i >= 0; i--) {
            LedgerEntry entry = entries.get(i);
            if (!entry.getSubscriptionId().equals(subscriptionId)) {
                continue;
            }
            if (entry.getOutcome() == ChargeOutcome.SUCCESS) {
                break;
            }
            if (entry.getOutcome() == ChargeOutcome.FAILED) {
                failures++;
            }
        }
        return failures;
    }
}
