package com.flagship.subscription_billing.subscription;

import com.flagship.subscription_billing.outbox.OutboxService;
import com.flagship.subscription_billing.subscription.event.SubscriptionCancelledEvent;
import com.flagship.subscription_billing.subscription.event.SubscriptionCreatedEvent;
import com.flagship.subscription_billing.subscription.event.SubscriptionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Every write to subscription state goes through here, paired with the
 * outbox event that describes it in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionLifecycleService {

    private final SubscriptionStore store;
    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional
    public Subscription open(Subscription subscription) {
        Subscription saved = store.insert(subscription);
        outboxService.saveEvent(SubscriptionCreatedEvent.from(saved));
        log.info("Subscription opened: subscriptionId={}, userId={}, planId={}, firstBillingDate={}",
                saved.getId(), saved.getUserId(), saved.getPlanId(), saved.getNextBillingDate());
        return saved;
    }

    /**
     * Applies the state computed from a charge attempt, guarded by the version
     * the attempt started from.
     *
     * @throws com.flagship.subscription_billing.subscription.exception.StaleSubscriptionException
     *         if the subscription changed or was cancelled meanwhile
     * @throws com.flagship.subscription_billing.subscription.exception.SubscriptionNotFoundException
     *         if it no longer exists
     */
    @Transactional
    public Subscription applyAttemptResult(Subscription before, SubscriptionStatus newStatus,
                                           LocalDate newNextBillingDate, SubscriptionEvent event) {
        Subscription after = store.updateAfterAttempt(
            before.getId(), before.getVersion(), newStatus, newNextBillingDate);
        outboxService.saveEvent(event);
        return after;
    }

    /**
     * Cancels on the user's behalf. Repeating the call changes nothing and
     * writes no second event.
     *
     * @return true if this call cancelled the subscription
     */
    @Transactional
    public boolean cancel(UUID subscriptionId) {
        boolean changed = store.cancel(subscriptionId, clock.instant());
        if (changed) {
            outboxService.saveEvent(SubscriptionCancelledEvent.of(
                subscriptionId, SubscriptionCancelledEvent.Reason.USER_REQUESTED, clock.instant()));
            log.info("Subscription cancelled: subscriptionId={}", subscriptionId);
        } else {
            log.info("Subscription already cancelled: subscriptionId={}", subscriptionId);
        }
        return changed;
    }
}
