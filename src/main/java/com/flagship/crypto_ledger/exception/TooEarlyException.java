package com.flagship.crypto_ledger.exception;

import java.time.Duration;
import java.time.Instant;

/**
 * The daily bonus was claimed less than one cooldown ago.
 */
public class TooEarlyException extends LedgerException {

    private final Duration remaining;
    private final Instant nextEligibleAt;

    public TooEarlyException(Duration remaining, Instant nextEligibleAt) {
        super("TooEarly", String.format("Bonus already claimed. Next bonus in %.1f hours",
            remaining.toMinutes() / 60.0));
        this.remaining = remaining;
        this.nextEligibleAt = nextEligibleAt;
    }

    public Duration getRemaining() {
        return remaining;
    }

    public Instant getNextEligibleAt() {
        return nextEligibleAt;
    }
}
