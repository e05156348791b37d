package com.flagship.crypto_ledger.bonus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.bonus.BonusClaim;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BonusClaimResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("claimed_at")
    Instant claimedAt;

    @JsonProperty("next_eligible_at")
    Instant nextEligibleAt;

    public static BonusClaimResponse from(BonusClaim claim) {
        return BonusClaimResponse.builder()
            .id(claim.getId())
            .accountId(claim.getAccountId())
            .currency(claim.getCurrency())
            .amount(claim.getAmount())
            .claimedAt(claim.getClaimedAt())
            .nextEligibleAt(claim.getNextEligibleAt())
            .build();
    }
}
