package com.flagship.crypto_ledger.bonus;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class BonusClaim {
    UUID id;
    UUID accountId;
    String currency;
    BigDecimal amount;
    Instant claimedAt;
    Instant nextEligibleAt;
}
