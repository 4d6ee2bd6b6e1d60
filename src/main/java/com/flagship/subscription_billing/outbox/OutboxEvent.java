package com.flagship.subscription_billing.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A subscription lifecycle event waiting in (or already sent from) the outbox.
 *
 * The outbox id equals the domain event id, so a consumer that sees the same
 * id twice knows it is a redelivery.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(UUID eventId, String aggregateType, UUID aggregateId,
                                      String eventType, String payload) {
        return new OutboxEvent(
            eventId,
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean hasExhaustedRetries(int maxRetries) {
        return retryCount >= maxRetries;
    }
}
