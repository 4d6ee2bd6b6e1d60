package com.flagship.subscription_billing.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.subscription_billing.billing.BillingAttemptService;
import com.flagship.subscription_billing.billing.BillingCycleProcessor;
import com.flagship.subscription_billing.billing.BillingRunControl;
import com.flagship.subscription_billing.billing.BillingRunSummary;
import com.flagship.subscription_billing.billing.BillingStateMachine;
import com.flagship.subscription_billing.catalog.BillingCycle;
import com.flagship.subscription_billing.catalog.Plan;
import com.flagship.subscription_billing.catalog.PlanCatalog;
import com.flagship.subscription_billing.charge.ChargeIdempotencyService;
import com.flagship.subscription_billing.config.BillingProperties;
import com.flagship.subscription_billing.config.IdempotencyProperties;
import com.flagship.subscription_billing.config.JacksonConfig;
import com.flagship.subscription_billing.observability.BillingMetrics;
import com.flagship.subscription_billing.outbox.OutboxService;
import com.flagship.subscription_billing.subscription.Subscription;
import com.flagship.subscription_billing.subscription.SubscriptionLifecycleService;
import com.flagship.subscription_billing.subscription.SubscriptionStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Billing engine wired against in-memory store, ledger and gateway, with
 * the real state machine, idempotency service and processor.
 */
public class BillingFixture implements AutoCloseable {

    public static final Plan MONTHLY_PLAN = new Plan(
        UUID.fromString("c9f0f895-fb98-4b91-9c4d-1a2b3c4d5e01"), "Basic", new BigDecimal("9.99"),
        BillingCycle.MONTHLY, true);

    public final MutableClock clock;
    public final InMemorySubscriptionStore store;
    public final InMemoryLedger ledger = new InMemoryLedger();
    public final ScriptedChargeExecutor gateway = new ScriptedChargeExecutor();
    public final OutboxService outboxService = mock(OutboxService.class);
    public final PlanCatalog planCatalog = mock(PlanCatalog.class);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final BillingProperties properties;
    public final SubscriptionLifecycleService lifecycleService;
    public final BillingAttemptService attemptService;
    public final BillingCycleProcessor processor;

    private final ExecutorService workerPool;

    public BillingFixture(Instant now, BillingProperties properties) {
        this.clock = new MutableClock(now);
        this.store = new InMemorySubscriptionStore(clock);
        this.properties = properties;
        this.workerPool = Executors.newFixedThreadPool(properties.getConcurrency());

        when(planCatalog.findById(MONTHLY_PLAN.getId())).thenReturn(Optional.of(MONTHLY_PLAN));
        when(planCatalog.requireActivePlan(MONTHLY_PLAN.getId())).thenReturn(MONTHLY_PLAN);

        ObjectMapper objectMapper = new JacksonConfig().objectMapper();
        BillingMetrics metrics = new BillingMetrics(meterRegistry);
        ChargeIdempotencyService idempotencyService = new ChargeIdempotencyService(
            ledger, Optional.empty(), new IdempotencyProperties(), objectMapper);

        this.lifecycleService = new SubscriptionLifecycleService(store, outboxService, clock);
        this.attemptService = new BillingAttemptService(
            planCatalog, ledger, gateway, idempotencyService, new BillingStateMachine(),
            lifecycleService, properties, metrics, clock);
        this.processor = new BillingCycleProcessor(store, attemptService, workerPool, properties);
    }

    public static BillingProperties properties(int batchSize, int concurrency, int escalationThreshold) {
        return new BillingProperties(batchSize, concurrency, Duration.ofMinutes(30), escalationThreshold, 5);
    }

    /** An ACTIVE monthly subscription due on {@code nextBillingDate}, stored directly. */
    public Subscription givenSubscription(LocalDate nextBillingDate) {
        return givenSubscription(SubscriptionStatus.ACTIVE, nextBillingDate);
    }

    public Subscription givenSubscription(SubscriptionStatus status, LocalDate nextBillingDate) {
        Subscription subscription = new Subscription(
            UUID.randomUUID(), UUID.randomUUID(), MONTHLY_PLAN.getId(), status, nextBillingDate,
            clock.instant(), status == SubscriptionStatus.CANCELLED ? clock.instant() : null, 0L);
        store.put(subscription);
        return subscription;
    }

    public BillingRunSummary run(LocalDate asOf) {
        return processor.run(asOf, BillingRunControl.withTimeout(properties.getRunTimeout(), clock));
    }

    public Subscription current(UUID subscriptionId) {
        return store.require(subscriptionId);
    }

    @Override
    public void close() {
        workerPool.shutdownNow();
    }
}
