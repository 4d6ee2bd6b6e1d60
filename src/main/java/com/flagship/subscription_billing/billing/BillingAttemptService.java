package com.flagship.subscription_billing.billing;

import com.flagship.subscription_billing.catalog.Plan;
import com.flagship.subscription_billing.catalog.PlanCatalog;
import com.flagship.subscription_billing.charge.ChargeExecutor;
import com.flagship.subscription_billing.charge.ChargeIdempotencyService;
import com.flagship.subscription_billing.charge.ChargeRequest;
import com.flagship.subscription_billing.charge.ChargeResult;
import com.flagship.subscription_billing.charge.IdempotencyKey;
import com.flagship.subscription_billing.charge.RecordedOutcome;
import com.flagship.subscription_billing.config.BillingProperties;
import com.flagship.subscription_billing.ledger.ChargeOutcome;
import com.flagship.subscription_billing.ledger.DuplicateChargeAttemptException;
import com.flagship.subscription_billing.ledger.Ledger;
import com.flagship.subscription_billing.ledger.LedgerEntry;
import com.flagship.subscription_billing.observability.BillingMetrics;
import com.flagship.subscription_billing.observability.CorrelationContext;
import com.flagship.subscription_billing.subscription.Subscription;
import com.flagship.subscription_billing.subscription.SubscriptionLifecycleService;
import com.flagship.subscription_billing.subscription.event.SubscriptionCancelledEvent;
import com.flagship.subscription_billing.subscription.event.SubscriptionEvent;
import com.flagship.subscription_billing.subscription.event.SubscriptionPastDueEvent;
import com.flagship.subscription_billing.subscription.event.SubscriptionRenewedEvent;
import com.flagship.subscription_billing.subscription.exception.StaleSubscriptionException;
import com.flagship.subscription_billing.subscription.exception.SubscriptionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Carries out one billing attempt for one subscription.
 *
 * Order of effects: charge, then ledger append, then the conditional
 * subscription update. No database lock or transaction is held while the
 * gateway is called. A failure of any step is reported in the returned
 * {@link AttemptResult}; nothing specific to one subscription is thrown, so
 * one bad subscription cannot abort a run.
 *
 * Re-running an attempt is safe. If the attempt's idempotency key already has
 * a determinate ledger entry (a previous run charged but crashed before the
 * subscription update), that outcome is replayed without charging again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingAttemptService {

    private final PlanCatalog planCatalog;
    private final Ledger ledger;
    private final ChargeExecutor chargeExecutor;
    private final ChargeIdempotencyService idempotencyService;
    private final BillingStateMachine stateMachine;
    private final SubscriptionLifecycleService lifecycleService;
    private final BillingProperties billingProperties;
    private final BillingMetrics metrics;
    private final Clock clock;

    public AttemptResult attempt(Subscription subscription) {
        MDC.put(CorrelationContext.SUBSCRIPTION_ID_MDC_KEY, subscription.getId().toString());
        try {
            AttemptResult result = doAttempt(subscription);
            metrics.recordAttempt(result.getOutcome().name());
            log.info("Billing attempt finished: subscriptionId={}, outcome={}, replayed={}, detail={}",
                    subscription.getId(), result.getOutcome(), result.isReplayed(), result.getDetail());
            return result;
        } finally {
            MDC.remove(CorrelationContext.SUBSCRIPTION_ID_MDC_KEY);
        }
    }

    private AttemptResult doAttempt(Subscription subscription) {
        if (!subscription.isBillable()) {
            return AttemptResult.of(subscription, AttemptOutcome.CONFLICT, null, false,
                    "subscription is " + subscription.getStatus());
        }

        LocalDate billingDate = subscription.getNextBillingDate();
        Plan plan;
        IdempotencyKey key;
        Optional<RecordedOutcome> recorded;
        try {
            Optional<Plan> found = planCatalog.findById(subscription.getPlanId());
            if (found.isEmpty()) {
                log.error("Plan missing for subscription: subscriptionId={}, planId={}",
                        subscription.getId(), subscription.getPlanId());
                return AttemptResult.of(subscription, AttemptOutcome.STORAGE_ERROR, null, false,
                        "plan not found: " + subscription.getPlanId());
            }
            plan = found.get();
            int previousFailures = ledger.countFailedAttempts(subscription.getId(), billingDate);
            key = IdempotencyKey.forAttempt(subscription.getId(), billingDate, previousFailures);
            recorded = idempotencyService.findRecordedOutcome(key.value());
        } catch (RuntimeException e) {
            log.error("Failed to prepare billing attempt: subscriptionId={}", subscription.getId(), e);
            return AttemptResult.of(subscription, AttemptOutcome.STORAGE_ERROR, null, false, e.getMessage());
        }

        LedgerEntry entry;
        boolean replayed = recorded.isPresent();
        if (replayed) {
            entry = recorded.get().getEntry();
            metrics.recordIdempotencyReplay(recorded.get().getSource().name());
            log.info("Replaying recorded outcome: idempotencyKey={}, outcome={}, source={}",
                    key, entry.getOutcome(), recorded.get().getSource());
        } else {
            entry = charge(subscription, plan, key);
            try {
                ledger.append(entry);
            } catch (DuplicateChargeAttemptException e) {
                log.warn("Concurrent attempt already recorded: idempotencyKey={}", key);
                return AttemptResult.of(subscription, AttemptOutcome.CONFLICT, null, false,
                        "attempt already recorded for " + key);
            } catch (RuntimeException e) {
                log.error("Ledger append failed: subscriptionId={}, idempotencyKey={}, outcome={}",
                        subscription.getId(), key, entry.getOutcome(), e);
                return AttemptResult.of(subscription, AttemptOutcome.STORAGE_ERROR, null, false, e.getMessage());
            }
            idempotencyService.remember(entry);
        }

        if (entry.getOutcome() == ChargeOutcome.PENDING) {
            return AttemptResult.of(subscription, AttemptOutcome.INDETERMINATE, entry.getId(), replayed,
                    entry.getFailureReason());
        }

        return applyOutcome(subscription, plan, entry, replayed);
    }

    private LedgerEntry charge(Subscription subscription, Plan plan, IdempotencyKey key) {
        ChargeRequest request = new ChargeRequest(
            subscription.getId(),
            subscription.getUserId(),
            plan.getPrice(),
            key.value(),
            plan.getName() + " subscription, billing date " + key.getBillingDate()
        );

        ChargeOutcome outcome;
        String gatewayTransactionId = null;
        String failureReason = null;
        long startTime = System.currentTimeMillis();
        try {
            ChargeResult result = chargeExecutor.charge(request);
            outcome = result.toOutcome();
            gatewayTransactionId = result.getGatewayTransactionId();
            failureReason = result.getFailureReason();
        } catch (RuntimeException e) {
            // Covers ChargeIndeterminateException and anything unexpected from the executor:
            // money may have moved, so record PENDING and retry with the same key.
            outcome = ChargeOutcome.PENDING;
            failureReason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Charge outcome unknown: idempotencyKey={}, reason={}", key, failureReason);
        }
        metrics.recordChargeLatency(outcome.name(), System.currentTimeMillis() - startTime);

        return LedgerEntry.record(
            subscription.getId(),
            plan.getPrice(),
            outcome,
            key.getBillingDate(),
            key.value(),
            gatewayTransactionId,
            failureReason,
            clock.instant()
        );
    }

    private AttemptResult applyOutcome(Subscription subscription, Plan plan, LedgerEntry entry, boolean replayed) {
        try {
            Transition target = stateMachine.transition(
                subscription.getStatus(), entry.getOutcome(), subscription.getNextBillingDate(),
                plan.getBillingCycle());

            int consecutiveFailures = 0;
            if (entry.getOutcome() == ChargeOutcome.FAILED) {
                consecutiveFailures = ledger.countConsecutiveFailures(subscription.getId());
                target = stateMachine.escalate(
                    target, consecutiveFailures, billingProperties.getEscalationThreshold());
            }

            SubscriptionEvent event = eventFor(entry, target, consecutiveFailures);
            Subscription updated = lifecycleService.applyAttemptResult(
                subscription, target.getStatus(), target.getNextBillingDate(), event);

            AttemptOutcome outcome;
            if (entry.getOutcome() == ChargeOutcome.SUCCESS) {
                outcome = AttemptOutcome.PROCESSED;
            } else if (target.isEscalated()) {
                outcome = AttemptOutcome.ESCALATED_TO_CANCELLED;
                metrics.recordSubscriptionCancelled(SubscriptionCancelledEvent.Reason.PAYMENT_FAILURES.name());
                log.warn("Subscription cancelled after {} consecutive failed charges: subscriptionId={}",
                        consecutiveFailures, subscription.getId());
            } else {
                outcome = AttemptOutcome.FAILED;
            }
            return AttemptResult.of(updated, outcome, entry.getId(), replayed, entry.getFailureReason());

        } catch (StaleSubscriptionException | SubscriptionNotFoundException e) {
            log.warn("Subscription changed during attempt: subscriptionId={}, reason={}",
                    subscription.getId(), e.getMessage());
            return AttemptResult.of(subscription, AttemptOutcome.CONFLICT, entry.getId(), replayed, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Subscription update failed after ledger append: subscriptionId={}, ledgerEntryId={}",
                    subscription.getId(), entry.getId(), e);
            return AttemptResult.of(subscription, AttemptOutcome.STORAGE_ERROR, entry.getId(), replayed,
                    e.getMessage());
        }
    }

    private SubscriptionEvent eventFor(LedgerEntry entry, Transition target, int consecutiveFailures) {
        if (entry.getOutcome() == ChargeOutcome.SUCCESS) {
            return SubscriptionRenewedEvent.from(entry, target.getNextBillingDate());
        }
        if (target.isEscalated()) {
            return SubscriptionCancelledEvent.of(
                entry.getSubscriptionId(), SubscriptionCancelledEvent.Reason.PAYMENT_FAILURES, clock.instant());
        }
        return SubscriptionPastDueEvent.from(entry, consecutiveFailures);
    }
}
