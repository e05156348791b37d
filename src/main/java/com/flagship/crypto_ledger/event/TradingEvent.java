package com.flagship.crypto_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a committed ledger change, written to the outbox in the
 * same transaction as the change itself.
 */
public interface TradingEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * Kafka key. All events of one aggregate keep their relative order.
     */
    @JsonIgnore
    UUID getAggregateId();

    /**
     * Account, Order, Offer or Bonus; selects the topic.
     */
    @JsonIgnore
    String getAggregateType();

    String getEventType();

    Instant getOccurredAt();
}
