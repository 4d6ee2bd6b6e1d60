package com.flagship.subscription_billing.ledger;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only record of every charge attempt.
 *
 * The billing cycle and the subscription create flow are the only writers.
 * Nothing updates or deletes an entry once {@link #append} returns.
 */
public interface Ledger {

    /**
     * Appends an entry.
     *
     * @return the entry id
     * @throws DuplicateChargeAttemptException if a determinate entry with the same
     *         idempotency key, or a second SUCCESS for the same billing date, exists
     * @throws LedgerWriteException if the write fails for any other reason
     */
    UUID append(LedgerEntry entry);

    /**
     * Entries for one subscription, most recent first, at most {@code limit} of them.
     * The returned iterable reads from storage lazily and can be iterated again.
     */
    LedgerHistory history(UUID subscriptionId, int limit);

    /**
     * The {@code perSubscription} most recent entries of each given subscription,
     * fetched in one query.
     */
    Map<UUID, List<LedgerEntry>> recentHistory(Collection<UUID> subscriptionIds, int perSubscription);

    Optional<LedgerEntry> findDeterminateByIdempotencyKey(String idempotencyKey);

    /**
     * FAILED entries recorded for one billing date of a subscription.
     */
    int countFailedAttempts(UUID subscriptionId, LocalDate billingDate);

    /**
     * FAILED entries since the last SUCCESS. PENDING entries neither count nor break the streak.
     */
    int countConsecutiveFailures(UUID subscriptionId);
}
