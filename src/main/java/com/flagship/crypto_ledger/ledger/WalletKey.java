package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.util.Comparator;
import java.util.UUID;

/**
 * Composite key of a wallet row. The natural order is the row-lock order
 * used by every multi-leg operation.
 */
@Value
public class WalletKey implements Comparable<WalletKey> {

    private static final Comparator<WalletKey> LOCK_ORDER = Comparator
        .comparing((WalletKey key) -> key.getAccountId().toString())
        .thenComparing(WalletKey::getCurrency);

    UUID accountId;
    String currency;

    @Override
    public int compareTo(WalletKey other) {
        return LOCK_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return accountId + "/" + currency;
    }
}
