package com.flagship.crypto_ledger.trading.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.trading.TradeTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("pair")
    String pair;

    @JsonProperty("side")
    String side;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("quote_amount")
    BigDecimal quoteAmount;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("fee_currency")
    String feeCurrency;

    @JsonProperty("executed_at")
    Instant executedAt;

    public static TransactionResponse from(TradeTransaction tx) {
        return TransactionResponse.builder()
            .id(tx.getId())
            .accountId(tx.getAccountId())
            .pair(tx.getPair().symbol())
            .side(tx.getSide().name())
            .amount(tx.getAmount())
            .price(tx.getPrice())
            .quoteAmount(tx.getQuoteAmount())
            .fee(tx.getFee())
            .feeCurrency(tx.getFeeCurrency())
            .executedAt(tx.getExecutedAt())
            .build();
    }
}
