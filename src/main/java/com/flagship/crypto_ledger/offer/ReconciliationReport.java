package com.flagship.crypto_ledger.offer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one escrow audit: every wallet whose locked_balance differs
 * from the total of its owner's active offers in that currency.
 */
@Value
public class ReconciliationReport {
    Instant checkedAt;
    int walletsChecked;
    List<Drift> drifts;

    public boolean isClean() {
        return drifts.isEmpty();
    }

    @Value
    public static class Drift {
        UUID accountId;
        String currency;
        BigDecimal lockedBalance;
        BigDecimal activeOfferTotal;
    }
}
