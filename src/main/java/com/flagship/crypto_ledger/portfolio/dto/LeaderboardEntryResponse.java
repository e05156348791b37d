package com.flagship.crypto_ledger.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.portfolio.LeaderboardEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class LeaderboardEntryResponse {

    @JsonProperty("rank")
    int rank;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("display_name")
    String displayName;

    @JsonProperty("total_value")
    BigDecimal totalValue;

    public static LeaderboardEntryResponse from(LeaderboardEntry entry) {
        return LeaderboardEntryResponse.builder()
            .rank(entry.getRank())
            .accountId(entry.getAccountId())
            .displayName(entry.getDisplayName())
            .totalValue(entry.getTotalValue())
            .build();
    }
}
