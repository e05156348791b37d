package com.flagship.crypto_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.ledger.Wallet;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class WalletResponse {

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("locked_balance")
    BigDecimal lockedBalance;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WalletResponse from(Wallet wallet) {
        return WalletResponse.builder()
            .currency(wallet.getCurrency())
            .balance(wallet.getBalance())
            .lockedBalance(wallet.getLockedBalance())
            .total(wallet.total())
            .updatedAt(wallet.getUpdatedAt())
            .build();
    }
}
