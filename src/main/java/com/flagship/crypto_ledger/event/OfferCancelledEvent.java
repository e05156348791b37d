package com.flagship.crypto_ledger.event;

import com.flagship.crypto_ledger.offer.TradeOffer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class OfferCancelledEvent implements TradingEvent {
    UUID eventId;
    UUID offerId;
    UUID creatorId;
    String releasedCurrency;
    BigDecimal releasedAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OfferCancelled";

    public static OfferCancelledEvent of(TradeOffer cancelled) {
        return new OfferCancelledEvent(UUID.randomUUID(), cancelled.getId(), cancelled.getCreatorId(),
            cancelled.getOfferingCurrency(), cancelled.getOfferingAmount(), cancelled.getUpdatedAt());
    }

    @Override
    public UUID getAggregateId() {
        return offerId;
    }

    @Override
    public String getAggregateType() {
        return "Offer";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
