package com.flagship.crypto_ledger.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.portfolio.RankInfo;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class RankResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("rank")
    int rank;

    @JsonProperty("total_accounts")
    int totalAccounts;

    @JsonProperty("percentile")
    BigDecimal percentile;

    @JsonProperty("total_value")
    BigDecimal totalValue;

    public static RankResponse from(RankInfo info) {
        return RankResponse.builder()
            .accountId(info.getAccountId())
            .rank(info.getRank())
            .totalAccounts(info.getTotalAccounts())
            .percentile(info.getPercentile())
            .totalValue(info.getTotalValue())
            .build();
    }
}
