package com.flagship.crypto_ledger.offer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.offer.P2PSettlement;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("offer_id")
    UUID offerId;

    @JsonProperty("creator_id")
    UUID creatorId;

    @JsonProperty("acceptor_id")
    UUID acceptorId;

    @JsonProperty("offering_currency")
    String offeringCurrency;

    @JsonProperty("offering_amount")
    BigDecimal offeringAmount;

    @JsonProperty("requesting_currency")
    String requestingCurrency;

    @JsonProperty("requesting_amount")
    BigDecimal requestingAmount;

    @JsonProperty("settled_at")
    Instant settledAt;

    public static SettlementResponse from(P2PSettlement settlement) {
        return SettlementResponse.builder()
            .id(settlement.getId())
            .offerId(settlement.getOfferId())
            .creatorId(settlement.getCreatorId())
            .acceptorId(settlement.getAcceptorId())
            .offeringCurrency(settlement.getOfferingCurrency())
            .offeringAmount(settlement.getOfferingAmount())
            .requestingCurrency(settlement.getRequestingCurrency())
            .requestingAmount(settlement.getRequestingAmount())
            .settledAt(settlement.getSettledAt())
            .build();
    }
}
