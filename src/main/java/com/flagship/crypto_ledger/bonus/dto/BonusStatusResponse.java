package com.flagship.crypto_ledger.bonus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.bonus.BonusStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class BonusStatusResponse {

    @JsonProperty("eligible")
    boolean eligible;

    @JsonProperty("last_claim_at")
    Instant lastClaimAt;

    @JsonProperty("next_eligible_at")
    Instant nextEligibleAt;

    @JsonProperty("remaining_seconds")
    long remainingSeconds;

    public static BonusStatusResponse from(BonusStatus status) {
        return BonusStatusResponse.builder()
            .eligible(status.isEligible())
            .lastClaimAt(status.getLastClaimAt())
            .nextEligibleAt(status.getNextEligibleAt())
            .remainingSeconds(status.getRemaining() == null ? 0 : status.getRemaining().toSeconds())
            .build();
    }
}
