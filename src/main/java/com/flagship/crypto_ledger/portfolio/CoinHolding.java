package com.flagship.crypto_ledger.portfolio;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CoinHolding {
    int rank;
    UUID accountId;
    String displayName;
    String currency;
    BigDecimal balance;
}
