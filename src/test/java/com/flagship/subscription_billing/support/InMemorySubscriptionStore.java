package com.flagship.subscription_billing.support;

import com.flagship.subscription_billing.subscription.DueCursor;
import com.flagship.subscription_billing.subscription.Subscription;
import com.flagship.subscription_billing.subscription.SubscriptionStatus;
import com.flagship.subscription_billing.subscription.SubscriptionStore;
import com.flagship.subscription_billing.subscription.exception.StaleSubscriptionException;
import com.flagship.subscription_billing.subscription.exception.SubscriptionNotFoundException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Subscription store held in memory, with the same conditional-update rules
 * as the JDBC store. Every method is synchronized, which plays the part of the
 * database's row-level atomicity.
 */
public class InMemorySubscriptionStore implements SubscriptionStore {

    private static final Comparator<Subscription> DUE_ORDER =
        Comparator.comparing(Subscription::getNextBillingDate).thenComparing(Subscription::getId);

    private final Map<UUID, Subscription> subscriptions = new HashMap<>();
    private final Set<UUID> failingUpdates = ConcurrentHashMap.newKeySet();
    private final Clock clock;
    private volatile boolean failFetches;

    public InMemorySubscriptionStore(Clock clock) {
        this.clock = clock;
    }

    /** Makes every update of this subscription fail like a lost database connection. */
    public void failUpdatesFor(UUID subscriptionId) {
        failingUpdates.add(subscriptionId);
    }

    public void clearFailingUpdates() {
        failingUpdates.clear();
    }

    public void failFetches(boolean fail) {
        this.failFetches = fail;
    }

    /** Stores a subscription as-is, for setting up arbitrary states. */
    public synchronized void put(Subscription subscription) {
        subscriptions.put(subscription.getId(), subscription);
    }

    public synchronized Subscription require(UUID id) {
        Subscription subscription = subscriptions.get(id);
        if (subscription == null) {
            throw new SubscriptionNotFoundException(id);
        }
        return subscription;
    }

    @Override
    public synchronized List<Subscription> findDue(LocalDate asOf, int limit) {
        return due(asOf, null, limit);
    }

    @Override
    public synchronized List<Subscription> findDueAfter(LocalDate asOf, DueCursor cursor, int limit) {
        return due(asOf, cursor, limit);
    }

    private List<Subscription> due(LocalDate asOf, DueCursor cursor, int limit) {
        if (failFetches) {
            throw new DataAccessResourceFailureException("store unreachable");
        }
        return subscriptions.values().stream()
            .filter(s -> s.isDueOn(asOf))
            .filter(s -> cursor == null || isAfter(s, cursor))
            .sorted(DUE_ORDER)
            .limit(limit)
            .collect(Collectors.toList());
    }

    private static boolean isAfter(Subscription subscription, DueCursor cursor) {
        int byDate = subscription.getNextBillingDate().compareTo(cursor.getNextBillingDate());
        return byDate > 0 || (byDate == 0 && subscription.getId().compareTo(cursor.getId()) > 0);
    }

    @Override
    public synchronized Optional<Subscription> findById(UUID id) {
        return Optional.ofNullable(subscriptions.get(id));
    }

    @Override
    public synchronized List<Subscription> findByUser(UUID userId, SubscriptionStatus status, int offset, int limit) {
        return subscriptions.values().stream()
            .filter(s -> userId == null || s.getUserId().equals(userId))
            .filter(s -> status == null || s.getStatus() == status)
            .sorted(Comparator.comparing(Subscription::getCreatedAt).reversed().thenComparing(Subscription::getId))
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized Subscription insert(Subscription subscription) {
        if (subscriptions.containsKey(subscription.getId())) {
            throw new IllegalStateException("Duplicate subscription id: " + subscription.getId());
        }
        subscriptions.put(subscription.getId(), subscription);
        return subscription;
    }

    @Override
    public synchronized Subscription updateAfterAttempt(UUID id, long expectedVersion,
                                                        SubscriptionStatus newStatus, LocalDate newNextBillingDate) {
        if (failingUpdates.contains(id)) {
            throw new DataAccessResourceFailureException("connection lost during update of " + id);
        }
        Subscription current = require(id);
        if (current.getVersion() != expectedVersion
                || current.getStatus() == SubscriptionStatus.CANCELLED
                || newNextBillingDate.isBefore(current.getNextBillingDate())) {
            throw new StaleSubscriptionException(id, expectedVersion);
        }
        Instant cancelledAt = newStatus == SubscriptionStatus.CANCELLED ? clock.instant() : current.getCancelledAt();
        Subscription updated = new Subscription(
            id, current.getUserId(), current.getPlanId(), newStatus, newNextBillingDate,
            current.getCreatedAt(), cancelledAt, current.getVersion() + 1);
        subscriptions.put(id, updated);
        return updated;
    }

    @Override
    public synchronized boolean cancel(UUID id, Instant cancelledAt) {
        Subscription current = require(id);
        if (current.getStatus() == SubscriptionStatus.CANCELLED) {
            return false;
        }
        subscriptions.put(id, new Subscription(
            id, current.getUserId(), current.getPlanId(), SubscriptionStatus.CANCELLED,
            current.getNextBillingDate(), current.getCreatedAt(), cancelledAt, current.getVersion() + 1));
        return true;
    }
}
