package com.flagship.crypto_ledger.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.portfolio.HoldingValue;
import com.flagship.crypto_ledger.portfolio.PortfolioValue;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class PortfolioResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("valuation_currency")
    String valuationCurrency;

    @JsonProperty("total_value")
    BigDecimal totalValue;

    @JsonProperty("holdings")
    List<Holding> holdings;

    @Value
    @Builder
    public static class Holding {

        @JsonProperty("currency")
        String currency;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("locked_balance")
        BigDecimal lockedBalance;

        // null when the currency has no price
        @JsonProperty("price")
        BigDecimal price;

        @JsonProperty("value")
        BigDecimal value;

        static Holding from(HoldingValue holding) {
            return Holding.builder()
                .currency(holding.getCurrency())
                .balance(holding.getBalance())
                .lockedBalance(holding.getLockedBalance())
                .price(holding.getPrice())
                .value(holding.getValue())
                .build();
        }
    }

    public static PortfolioResponse from(PortfolioValue portfolio) {
        return PortfolioResponse.builder()
            .accountId(portfolio.getAccountId())
            .valuationCurrency(portfolio.getValuationCurrency())
            .totalValue(portfolio.getTotalValue())
            .holdings(portfolio.getHoldings().stream().map(Holding::from).toList())
            .build();
    }
}
