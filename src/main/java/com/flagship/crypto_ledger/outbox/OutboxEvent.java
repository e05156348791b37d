package com.flagship.crypto_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A trading event waiting in (or already drained from) the outbox table.
 *
 * Written atomically with the ledger change it describes and published to
 * Kafka afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // Account, Order, Offer, Bonus
    UUID aggregateId;
    String eventType;          // e.g. OfferSettled
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until Kafka acknowledged it
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database
    String correlationId;      // request that caused the change, sent as a Kafka header

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, String correlationId, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            createdAt, null, 0, null, null, correlationId);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
