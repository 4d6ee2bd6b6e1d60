package com.flagship.subscription_billing.subscription;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent subscription state.
 */
public interface SubscriptionStore {

    /**
     * Billable subscriptions with {@code nextBillingDate <= asOf}, ordered by
     * billing date then id, at most {@code limit}.
     */
    List<Subscription> findDue(LocalDate asOf, int limit);

    /**
     * Same as {@link #findDue} but strictly after {@code cursor} in that ordering.
     */
    List<Subscription> findDueAfter(LocalDate asOf, DueCursor cursor, int limit);

    Optional<Subscription> findById(UUID id);

    /**
     * Newest first. {@code userId} and {@code status} are optional filters.
     */
    List<Subscription> findByUser(UUID userId, SubscriptionStatus status, int offset, int limit);

    Subscription insert(Subscription subscription);

    /**
     * Records the result of a billing attempt.
     *
     * Succeeds only if the stored version still equals {@code expectedVersion},
     * the subscription is not cancelled, and the billing date does not move backwards.
     *
     * @return the updated subscription, with its version bumped
     * @throws com.flagship.subscription_billing.subscription.exception.SubscriptionNotFoundException
     *         if the subscription does not exist
     * @throws com.flagship.subscription_billing.subscription.exception.StaleSubscriptionException
     *         if any guard fails
     */
    Subscription updateAfterAttempt(UUID id, long expectedVersion,
                                    SubscriptionStatus newStatus, LocalDate newNextBillingDate);

    /**
     * Cancels regardless of version.
     *
     * @return true if the subscription changed, false if it was already cancelled
     * @throws com.flagship.subscription_billing.subscription.exception.SubscriptionNotFoundException
     *         if the subscription does not exist
     */
    boolean cancel(UUID id, Instant cancelledAt);
}
