package com.flagship.crypto_ledger.offer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of an accepted offer: who swapped what with whom.
 */
@Value
public class P2PSettlement {
    UUID id;
    UUID offerId;
    UUID creatorId;
    UUID acceptorId;
    String offeringCurrency;
    BigDecimal offeringAmount;
    String requestingCurrency;
    BigDecimal requestingAmount;
    Instant settledAt;

    public static P2PSettlement of(TradeOffer completed) {
        return new P2PSettlement(UUID.randomUUID(), completed.getId(), completed.getCreatorId(),
            completed.getAcceptedBy(), completed.getOfferingCurrency(), completed.getOfferingAmount(),
            completed.getRequestingCurrency(), completed.getRequestingAmount(), completed.getUpdatedAt());
    }
}
