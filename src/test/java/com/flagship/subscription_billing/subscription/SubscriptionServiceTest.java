package com.flagship.subscription_billing.subscription;

import com.flagship.subscription_billing.account.UserDirectory;
import com.flagship.subscription_billing.ledger.ChargeOutcome;
import com.flagship.subscription_billing.ledger.LedgerEntry;
import com.flagship.subscription_billing.observability.BillingMetrics;
import com.flagship.subscription_billing.subscription.event.SubscriptionCancelledEvent;
import com.flagship.subscription_billing.subscription.event.SubscriptionEvent;
import com.flagship.subscription_billing.subscription.exception.InvalidSubscriptionRequestException;
import com.flagship.subscription_billing.subscription.exception.SubscriptionNotFoundException;
import com.flagship.subscription_billing.support.BillingFixture;
import com.flagship.subscription_billing.support.ScriptedChargeExecutor.Answer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubscriptionServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-31T10:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 1, 31);

    private BillingFixture fixture;
    private UserDirectory userDirectory;
    private SubscriptionService service;

    @BeforeEach
    void setUp() {
        fixture = new BillingFixture(NOW, BillingFixture.properties(10, 2, 3));
        userDirectory = mock(UserDirectory.class);
        service = new SubscriptionService(
            userDirectory, fixture.planCatalog, fixture.store, fixture.lifecycleService,
            fixture.attemptService, fixture.ledger, fixture.properties,
            new BillingMetrics(fixture.meterRegistry), fixture.clock);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private SubscriptionDetails create() {
        return service.create(UUID.randomUUID(), BillingFixture.MONTHLY_PLAN.getId());
    }

    @Test
    @DisplayName("Create charges the first period and anchors the next bill a month later")
    void createChargesFirstPeriod() {
        SubscriptionDetails details = create();

        Subscription subscription = details.getSubscription();
        assertEquals(SubscriptionStatus.ACTIVE, subscription.getStatus());
        // Jan 31 clamps to Feb 29 in a leap year
        assertEquals(LocalDate.of(2024, 2, 29), subscription.getNextBillingDate());
        assertEquals(1, subscription.getVersion());

        assertEquals(1, details.getRecentCharges().size());
        LedgerEntry charge = details.getRecentCharges().get(0);
        assertEquals(ChargeOutcome.SUCCESS, charge.getOutcome());
        assertEquals(TODAY, charge.getBillingDate());
        assertEquals(0, BillingFixture.MONTHLY_PLAN.getPrice().compareTo(charge.getAmount()));

        ArgumentCaptor<SubscriptionEvent> events = ArgumentCaptor.forClass(SubscriptionEvent.class);
        verify(fixture.outboxService, times(2)).saveEvent(events.capture());
        assertEquals(List.of("SubscriptionCreated", "SubscriptionRenewed"),
            events.getAllValues().stream().map(SubscriptionEvent::getEventType).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("A declined first charge still creates the subscription, PAST_DUE on today's date")
    void declinedFirstCharge() {
        fixture.gateway.setDefaultAnswer(Answer.DECLINE);

        SubscriptionDetails details = create();

        assertEquals(SubscriptionStatus.PAST_DUE, details.getSubscription().getStatus());
        assertEquals(TODAY, details.getSubscription().getNextBillingDate());
        assertEquals(ChargeOutcome.FAILED, details.getRecentCharges().get(0).getOutcome());
        assertEquals("card_declined", details.getRecentCharges().get(0).getFailureReason());
    }

    @Test
    @DisplayName("A gateway timeout on the first charge leaves the subscription ACTIVE and due")
    void indeterminateFirstCharge() {
        fixture.gateway.setDefaultAnswer(Answer.TIMEOUT);

        SubscriptionDetails details = create();

        assertEquals(SubscriptionStatus.ACTIVE, details.getSubscription().getStatus());
        assertEquals(TODAY, details.getSubscription().getNextBillingDate());
        assertEquals(ChargeOutcome.PENDING, details.getRecentCharges().get(0).getOutcome());
    }

    @Test
    @DisplayName("Unknown or inactive users and plans are rejected before anything is written")
    void rejectsInvalidReferences() {
        UUID inactiveUser = UUID.randomUUID();
        doThrow(new IllegalArgumentException("User is not active: " + inactiveUser))
            .when(userDirectory).requireActiveUser(inactiveUser);
        UUID retiredPlan = UUID.randomUUID();
        when(fixture.planCatalog.requireActivePlan(retiredPlan))
            .thenThrow(new IllegalArgumentException("Plan is not active: " + retiredPlan));

        assertThrows(IllegalArgumentException.class,
            () -> service.create(inactiveUser, BillingFixture.MONTHLY_PLAN.getId()));
        assertThrows(IllegalArgumentException.class, () -> service.create(UUID.randomUUID(), retiredPlan));
        assertThrows(InvalidSubscriptionRequestException.class, () -> service.create(null, retiredPlan));

        assertTrue(fixture.store.findByUser(null, null, 0, 10).isEmpty());
        assertTrue(fixture.gateway.requests().isEmpty());
        verify(fixture.outboxService, times(0)).saveEvent(any());
    }

    @Test
    @DisplayName("Cancel is idempotent and the next run skips the subscription")
    void cancelIsIdempotent() {
        UUID id = create().getSubscription().getId();

        SubscriptionDetails first = service.cancel(id);
        SubscriptionDetails second = service.cancel(id);

        assertEquals(SubscriptionStatus.CANCELLED, first.getSubscription().getStatus());
        assertNotNull(first.getSubscription().getCancelledAt());
        assertEquals(first.getSubscription(), second.getSubscription());

        ArgumentCaptor<SubscriptionEvent> events = ArgumentCaptor.forClass(SubscriptionEvent.class);
        verify(fixture.outboxService, times(3)).saveEvent(events.capture());
        assertEquals(1, events.getAllValues().stream()
            .filter(e -> e instanceof SubscriptionCancelledEvent).count());

        assertEquals(0, fixture.run(LocalDate.of(2024, 3, 31)).getConsidered());
        assertEquals(1, fixture.gateway.requestsFor(id));
    }

    @Test
    void cancelUnknownSubscription() {
        assertThrows(SubscriptionNotFoundException.class, () -> service.cancel(UUID.randomUUID()));
    }

    @Test
    @DisplayName("List filters by user and status, newest first, with recent charges attached")
    void listFilters() {
        UUID userId = UUID.randomUUID();
        SubscriptionDetails older = service.create(userId, BillingFixture.MONTHLY_PLAN.getId());
        fixture.clock.advance(Duration.ofMinutes(1));
        SubscriptionDetails newer = service.create(userId, BillingFixture.MONTHLY_PLAN.getId());
        create();
        service.cancel(older.getSubscription().getId());

        List<SubscriptionDetails> mine = service.list(userId, null, 0, 10);
        assertEquals(List.of(newer.getSubscription().getId(), older.getSubscription().getId()),
            mine.stream().map(d -> d.getSubscription().getId()).collect(Collectors.toList()));
        assertTrue(mine.stream().allMatch(d -> d.getRecentCharges().size() == 1));

        List<SubscriptionDetails> active = service.list(userId, SubscriptionStatus.ACTIVE, 0, 10);
        assertEquals(1, active.size());
        assertEquals(newer.getSubscription().getId(), active.get(0).getSubscription().getId());

        assertEquals(1, service.list(userId, null, 1, 10).size());
        assertEquals(3, service.list(null, null, 0, 100).size());
    }

    @Test
    void listRejectsBadPaging() {
        assertThrows(InvalidSubscriptionRequestException.class, () -> service.list(null, null, -1, 10));
        assertThrows(InvalidSubscriptionRequestException.class, () -> service.list(null, null, 0, 0));
        assertThrows(InvalidSubscriptionRequestException.class, () -> service.list(null, null, 0, 101));
    }

    @Test
    @DisplayName("Ledger returns every attempt, newest first, up to the limit")
    void ledgerNewestFirst() {
        fixture.gateway.setDefaultAnswer(Answer.DECLINE);
        UUID id = create().getSubscription().getId();
        fixture.run(TODAY);
        fixture.gateway.setDefaultAnswer(Answer.APPROVE);
        fixture.run(TODAY);

        List<LedgerEntry> entries = service.ledger(id, 50);
        assertEquals(List.of(ChargeOutcome.SUCCESS, ChargeOutcome.FAILED, ChargeOutcome.FAILED),
            entries.stream().map(LedgerEntry::getOutcome).collect(Collectors.toList()));
        assertEquals(2, service.ledger(id, 2).size());

        assertThrows(SubscriptionNotFoundException.class, () -> service.ledger(UUID.randomUUID(), 10));
        assertThrows(InvalidSubscriptionRequestException.class, () -> service.ledger(id, 0));
    }
}
