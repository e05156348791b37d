package com.flagship.crypto_ledger.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.portfolio.CoinHolding;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CoinHoldingResponse {

    @JsonProperty("rank")
    int rank;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("display_name")
    String displayName;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    BigDecimal balance;

    public static CoinHoldingResponse from(CoinHolding holding) {
        return CoinHoldingResponse.builder()
            .rank(holding.getRank())
            .accountId(holding.getAccountId())
            .displayName(holding.getDisplayName())
            .currency(holding.getCurrency())
            .balance(holding.getBalance())
            .build();
    }
}
