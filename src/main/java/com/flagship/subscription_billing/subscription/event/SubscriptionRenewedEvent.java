package com.flagship.subscription_billing.subscription.event;

import com.flagship.subscription_billing.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A billing date was charged successfully and the subscription moved to its next period.
 */
@Value
public class SubscriptionRenewedEvent implements SubscriptionEvent {
    UUID eventId;
    UUID subscriptionId;
    UUID ledgerEntryId;
    BigDecimal amount;
    LocalDate billedDate;
    LocalDate nextBillingDate;
    String gatewayTransactionId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SubscriptionRenewed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SubscriptionRenewedEvent from(LedgerEntry charge, LocalDate nextBillingDate) {
        return new SubscriptionRenewedEvent(
            UUID.randomUUID(),
            charge.getSubscriptionId(),
            charge.getId(),
            charge.getAmount(),
            charge.getBillingDate(),
            nextBillingDate,
            charge.getGatewayTransactionId(),
            charge.getProcessedAt()
        );
    }
}
