package com.flagship.crypto_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class BonusClaimedEvent implements TradingEvent {
    UUID eventId;
    UUID claimId;
    UUID accountId;
    String currency;
    BigDecimal amount;
    Instant nextEligibleAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BonusClaimed";

    @Override
    public UUID getAggregateId() {
        return accountId;
    }

    @Override
    public String getAggregateType() {
        return "Bonus";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
