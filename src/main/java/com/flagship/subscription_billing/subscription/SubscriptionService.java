package com.flagship.subscription_billing.subscription;

import com.flagship.subscription_billing.account.UserDirectory;
import com.flagship.subscription_billing.billing.AttemptResult;
import com.flagship.subscription_billing.billing.BillingAttemptService;
import com.flagship.subscription_billing.catalog.PlanCatalog;
import com.flagship.subscription_billing.config.BillingProperties;
import com.flagship.subscription_billing.ledger.Ledger;
import com.flagship.subscription_billing.ledger.LedgerEntry;
import com.flagship.subscription_billing.observability.BillingMetrics;
import com.flagship.subscription_billing.subscription.exception.InvalidSubscriptionRequestException;
import com.flagship.subscription_billing.subscription.exception.SubscriptionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Subscription operations exposed over HTTP.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    static final int MAX_PAGE_SIZE = 100;

    private final UserDirectory userDirectory;
    private final PlanCatalog planCatalog;
    private final SubscriptionStore subscriptionStore;
    private final SubscriptionLifecycleService lifecycleService;
    private final BillingAttemptService attemptService;
    private final Ledger ledger;
    private final BillingProperties billingProperties;
    private final BillingMetrics metrics;
    private final Clock clock;

    /**
     * Opens a subscription for an active user on an active plan and bills the
     * first period straight away.
     *
     * The subscription is returned whatever the first charge's outcome: after a
     * decline it is PAST_DUE and the next billing run retries it.
     */
    public SubscriptionDetails create(UUID userId, UUID planId) {
        if (userId == null || planId == null) {
            throw new InvalidSubscriptionRequestException("user_id and plan_id are required");
        }
        userDirectory.requireActiveUser(userId);
        planCatalog.requireActivePlan(planId);

        LocalDate today = LocalDate.now(clock);
        Subscription opened = lifecycleService.open(Subscription.open(userId, planId, today, clock.instant()));

        AttemptResult firstCharge = attemptService.attempt(opened);
        metrics.recordSubscriptionCreated(firstCharge.getOutcome().name());
        log.info("First charge for new subscription: subscriptionId={}, outcome={}",
                opened.getId(), firstCharge.getOutcome());

        return get(opened.getId());
    }

    public SubscriptionDetails get(UUID subscriptionId) {
        Subscription subscription = subscriptionStore.findById(subscriptionId)
            .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
        List<LedgerEntry> recent = ledger.history(subscriptionId, billingProperties.getHistoryLimit()).toList();
        return new SubscriptionDetails(subscription, recent);
    }

    /**
     * Newest first, each with its recent ledger entries loaded in one query.
     */
    public List<SubscriptionDetails> list(UUID userId, SubscriptionStatus status, int offset, int limit) {
        if (offset < 0) {
            throw new InvalidSubscriptionRequestException("offset cannot be negative: " + offset);
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidSubscriptionRequestException(
                "limit must be between 1 and " + MAX_PAGE_SIZE + ": " + limit);
        }

        List<Subscription> subscriptions = subscriptionStore.findByUser(userId, status, offset, limit);
        if (subscriptions.isEmpty()) {
            return Collections.emptyList();
        }

        Map<UUID, List<LedgerEntry>> history = ledger.recentHistory(
            subscriptions.stream().map(Subscription::getId).collect(Collectors.toList()),
            billingProperties.getHistoryLimit());

        return subscriptions.stream()
            .map(s -> new SubscriptionDetails(s, history.getOrDefault(s.getId(), Collections.emptyList())))
            .collect(Collectors.toList());
    }

    public List<LedgerEntry> ledger(UUID subscriptionId, int limit) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidSubscriptionRequestException(
                "limit must be between 1 and " + MAX_PAGE_SIZE + ": " + limit);
        }
        if (subscriptionStore.findById(subscriptionId).isEmpty()) {
            throw new SubscriptionNotFoundException(subscriptionId);
        }
        return ledger.history(subscriptionId, limit).toList();
    }

    /**
     * Idempotent: cancelling an already cancelled subscription succeeds and changes nothing.
     */
    public SubscriptionDetails cancel(UUID subscriptionId) {
        boolean changed = lifecycleService.cancel(subscriptionId);
        if (changed) {
            metrics.recordSubscriptionCancelled("user_requested");
        }
        return get(subscriptionId);
    }
}
