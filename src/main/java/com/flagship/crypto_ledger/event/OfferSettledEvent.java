package com.flagship.crypto_ledger.event;

import com.flagship.crypto_ledger.offer.P2PSettlement;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Both legs of an offer were swapped and the offer is COMPLETED.
 */
@Value
public class OfferSettledEvent implements TradingEvent {
    UUID eventId;
    UUID offerId;
    UUID settlementId;
    UUID creatorId;
    UUID acceptorId;
    String offeringCurrency;
    BigDecimal offeringAmount;
    String requestingCurrency;
    BigDecimal requestingAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OfferSettled";

    public static OfferSettledEvent of(P2PSettlement settlement) {
        return new OfferSettledEvent(UUID.randomUUID(), settlement.getOfferId(), settlement.getId(),
            settlement.getCreatorId(), settlement.getAcceptorId(),
            settlement.getOfferingCurrency(), settlement.getOfferingAmount(),
            settlement.getRequestingCurrency(), settlement.getRequestingAmount(), settlement.getSettledAt());
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
