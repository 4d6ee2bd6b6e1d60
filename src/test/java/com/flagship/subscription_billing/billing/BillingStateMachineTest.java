package com.flagship.subscription_billing.billing;

import com.flagship.subscription_billing.catalog.BillingCycle;
import com.flagship.subscription_billing.ledger.ChargeOutcome;
import com.flagship.subscription_billing.subscription.SubscriptionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class BillingStateMachineTest {

    private static final LocalDate DUE = LocalDate.of(2024, 2, 15);

    private final BillingStateMachine stateMachine = new BillingStateMachine();

    @ParameterizedTest(name = "{0} + {1} -> {2}, {3}")
    @CsvSource({
        "ACTIVE,    SUCCESS, ACTIVE,    2024-03-15",
        "ACTIVE,    FAILED,  PAST_DUE,  2024-02-15",
        "PAST_DUE,  SUCCESS, ACTIVE,    2024-03-15",
        "PAST_DUE,  FAILED,  PAST_DUE,  2024-02-15",
        "CANCELLED, SUCCESS, CANCELLED, 2024-02-15",
        "CANCELLED, FAILED,  CANCELLED, 2024-02-15",
        "ACTIVE,    PENDING, ACTIVE,    2024-02-15",
        "PAST_DUE,  PENDING, PAST_DUE,  2024-02-15"
    })
    @DisplayName("Transition table")
    void transitionTable(SubscriptionStatus current, ChargeOutcome outcome,
                         SubscriptionStatus expectedStatus, LocalDate expectedDate) {
        Transition transition = stateMachine.transition(current, outcome, DUE, BillingCycle.MONTHLY);

        assertEquals(expectedStatus, transition.getStatus());
        assertEquals(expectedDate, transition.getNextBillingDate());
        assertFalse(transition.isEscalated());
    }

    @Test
    @DisplayName("Success advances from the billed date by the plan's cycle")
    void advancesByCycle() {
        assertEquals(LocalDate.of(2024, 2, 22),
            stateMachine.transition(SubscriptionStatus.ACTIVE, ChargeOutcome.SUCCESS, DUE, BillingCycle.WEEKLY)
                .getNextBillingDate());
        assertEquals(LocalDate.of(2025, 2, 15),
            stateMachine.transition(SubscriptionStatus.ACTIVE, ChargeOutcome.SUCCESS, DUE, BillingCycle.YEARLY)
                .getNextBillingDate());
    }

    @Test
    @DisplayName("A PAST_DUE target is cancelled once failures reach the threshold")
    void escalatesAtThreshold() {
        Transition pastDue = stateMachine.transition(
            SubscriptionStatus.PAST_DUE, ChargeOutcome.FAILED, DUE, BillingCycle.MONTHLY);

        assertSame(pastDue, stateMachine.escalate(pastDue, 2, 3));

        Transition escalated = stateMachine.escalate(pastDue, 3, 3);
        assertEquals(SubscriptionStatus.CANCELLED, escalated.getStatus());
        assertEquals(DUE, escalated.getNextBillingDate());
        assertTrue(escalated.isEscalated());
    }

    @Test
    @DisplayName("Escalation never touches a successful renewal and is off at threshold zero")
    void escalationOnlyForFailures() {
        Transition renewed = stateMachine.transition(
            SubscriptionStatus.PAST_DUE, ChargeOutcome.SUCCESS, DUE, BillingCycle.MONTHLY);
        assertSame(renewed, stateMachine.escalate(renewed, 10, 3));

        Transition pastDue = stateMachine.transition(
            SubscriptionStatus.ACTIVE, ChargeOutcome.FAILED, DUE, BillingCycle.MONTHLY);
        assertSame(pastDue, stateMachine.escalate(pastDue, 10, 0));
    }

    @Test
    void nullInputsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> stateMachine.transition(null, ChargeOutcome.SUCCESS, DUE, BillingCycle.MONTHLY));
        assertThrows(IllegalArgumentException.class,
            () -> stateMachine.transition(SubscriptionStatus.ACTIVE, ChargeOutcome.SUCCESS, DUE, null));
    }
}
