package com.flagship.crypto_ledger.event;

import com.flagship.crypto_ledger.offer.TradeOffer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class OfferCreatedEvent implements TradingEvent {
    UUID eventId;
    UUID offerId;
    UUID creatorId;
    String offeringCurrency;
    BigDecimal offeringAmount;
    String requestingCurrency;
    BigDecimal requestingAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OfferCreated";

    public static OfferCreatedEvent of(TradeOffer offer) {
        return new OfferCreatedEvent(UUID.randomUUID(), offer.getId(), offer.getCreatorId(),
            offer.getOfferingCurrency(), offer.getOfferingAmount(),
            offer.getRequestingCurrency(), offer.getRequestingAmount(), offer.getCreatedAt());
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
