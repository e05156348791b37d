package com.flagship.crypto_ledger.portfolio;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * percentile = (totalAccounts - rank) / totalAccounts * 100; the top account of N scores (N-1)/N*100.
 */
@Value
public class RankInfo {
    UUID accountId;
    int rank;
    int totalAccounts;
    BigDecimal percentile;
    BigDecimal totalValue;
}
