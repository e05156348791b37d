package com.flagship.crypto_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.account.Account;
import com.flagship.crypto_ledger.ledger.Wallet;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("external_id")
    String externalId;

    @JsonProperty("display_name")
    String displayName;

    @JsonProperty("last_bonus_claim")
    Instant lastBonusClaim;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("wallets")
    List<WalletResponse> wallets;

    public static AccountResponse from(Account account, List<Wallet> wallets) {
        return AccountResponse.builder()
            .id(account.getId())
            .externalId(account.getExternalId())
            .displayName(account.getDisplayName())
            .lastBonusClaim(account.getLastBonusClaim())
            .createdAt(account.getCreatedAt())
            .wallets(wallets.stream().map(WalletResponse::from).toList())
            .build();
    }
}
