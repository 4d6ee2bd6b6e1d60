package com.flagship.subscription_billing.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One row of the billing ledger: a single charge attempt and its outcome.
 *
 * Entries are immutable once appended. {@code sequenceNumber} is assigned by
 * the database and is null until the entry has been written.
 */
@Value
public class LedgerEntry {
    UUID id;
    Long sequenceNumber;
    UUID subscriptionId;
    BigDecimal amount;
    ChargeOutcome outcome;
    LocalDate billingDate;
    String idempotencyKey;
    String gatewayTransactionId;
    String failureReason;
    Instant processedAt;

    /**
     * Creates an unsaved entry for an attempt.
     */
    public static LedgerEntry record(UUID subscriptionId, BigDecimal amount, ChargeOutcome outcome,
                                     LocalDate billingDate, String idempotencyKey,
                                     String gatewayTransactionId, String failureReason,
                                     Instant processedAt) {
        if (subscriptionId == null) {
            throw new IllegalArgumentException("Subscription ID cannot be null");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be zero or positive: " + amount);
        }
        if (outcome == null) {
            throw new IllegalArgumentException("Outcome cannot be null");
        }
        if (billingDate == null) {
            throw new IllegalArgumentException("Billing date cannot be null");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }
        return new LedgerEntry(
            UUID.randomUUID(),
            null,
            subscriptionId,
            amount,
            outcome,
            billingDate,
            idempotencyKey,
            gatewayTransactionId,
            failureReason,
            processedAt
        );
    }
}
