package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of one (account, currency) balance row.
 *
 * balance is spendable; lockedBalance backs active trade offers.
 * Both are always non-negative (enforced by the conditional updates in
 * {@link WalletStore} and by CHECK constraints on the table).
 */
@Value
public class Wallet {
    UUID accountId;
    String currency;
    BigDecimal balance;
    BigDecimal lockedBalance;
    Instant updatedAt;

    public WalletKey key() {
        return new WalletKey(accountId, currency);
    }

    /**
     * balance + lockedBalance: what the account owns in this currency.
     */
    public BigDecimal total() {
        return balance.add(lockedBalance);
    }
}
