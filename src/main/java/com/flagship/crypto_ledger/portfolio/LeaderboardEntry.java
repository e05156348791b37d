package com.flagship.crypto_ledger.portfolio;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class LeaderboardEntry {
    int rank;
    UUID accountId;
    String displayName;
    BigDecimal totalValue;
}
