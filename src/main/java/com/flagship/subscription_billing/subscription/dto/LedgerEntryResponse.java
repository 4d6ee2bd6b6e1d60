package com.flagship.subscription_billing.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.subscription_billing.ledger.ChargeOutcome;
import com.flagship.subscription_billing.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("outcome")
    ChargeOutcome outcome;

    @JsonProperty("billing_date")
    LocalDate billingDate;

    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @JsonProperty("gateway_transaction_id")
    String gatewayTransactionId;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .sequenceNumber(entry.getSequenceNumber())
            .amount(entry.getAmount())
            .outcome(entry.getOutcome())
            .billingDate(entry.getBillingDate())
            .idempotencyKey(entry.getIdempotencyKey())
            .gatewayTransactionId(entry.getGatewayTransactionId())
            .failureReason(entry.getFailureReason())
            .processedAt(entry.getProcessedAt())
            .build();
    }
}
