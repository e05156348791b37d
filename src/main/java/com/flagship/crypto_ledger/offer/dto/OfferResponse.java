package com.flagship.crypto_ledger.offer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.offer.OfferListing;
import com.flagship.crypto_ledger.offer.TradeOffer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OfferResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("creator_id")
    UUID creatorId;

    @JsonProperty("creator_name")
    String creatorName;

    @JsonProperty("offering_currency")
    String offeringCurrency;

    @JsonProperty("offering_amount")
    BigDecimal offeringAmount;

    @JsonProperty("requesting_currency")
    String requestingCurrency;

    @JsonProperty("requesting_amount")
    BigDecimal requestingAmount;

    @JsonProperty("status")
    String status;

    @JsonProperty("accepted_by")
    UUID acceptedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static OfferResponse from(TradeOffer offer) {
        return from(offer, null);
    }

    public static OfferResponse from(OfferListing listing) {
        return from(listing.getOffer(), listing.getCreatorName());
    }

    private static OfferResponse from(TradeOffer offer, String creatorName) {
        return OfferResponse.builder()
            .id(offer.getId())
            .creatorId(offer.getCreatorId())
            .creatorName(creatorName)
            .offeringCurrency(offer.getOfferingCurrency())
            .offeringAmount(offer.getOfferingAmount())
            .requestingCurrency(offer.getRequestingCurrency())
            .requestingAmount(offer.getRequestingAmount())
            .status(offer.getStatus().name())
            .acceptedBy(offer.getAcceptedBy())
            .createdAt(offer.getCreatedAt())
            .updatedAt(offer.getUpdatedAt())
            .build();
    }
}
