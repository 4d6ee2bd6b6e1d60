package com.flagship.subscription_billing.subscription.event;

import com.flagship.subscription_billing.ledger.LedgerEntry;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class SubscriptionPastDueEvent implements SubscriptionEvent {
    UUID eventId;
    UUID subscriptionId;
    UUID ledgerEntryId;
    LocalDate billingDate;
    String failureReason;
    int consecutiveFailures;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SubscriptionPastDue";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SubscriptionPastDueEvent from(LedgerEntry charge, int consecutiveFailures) {
        return new SubscriptionPastDueEvent(
            UUID.randomUUID(),
            charge.getSubscriptionId(),
            charge.getId(),
            charge.getBillingDate(),
            charge.getFailureReason(),
            consecutiveFailures,
            charge.getProcessedAt()
        );
    }
}
