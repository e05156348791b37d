package com.flagship.crypto_ledger.bonus;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Whether a claim made now would succeed. Informational only; the claim itself re-checks atomically.
 */
@Value
public class BonusStatus {
    boolean eligible;
    Instant lastClaimAt;
    Instant nextEligibleAt;
    Duration remaining;
}
