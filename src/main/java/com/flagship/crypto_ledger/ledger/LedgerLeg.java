package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * One balance movement on one wallet. Amounts are always positive;
 * the direction comes from the leg type.
 */
@Value
public class LedgerLeg {
    UUID accountId;
    String currency;
    BigDecimal amount;
    LegType type;

    private LedgerLeg(UUID accountId, String currency, BigDecimal amount, LegType type) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static LedgerLeg credit(UUID accountId, String currency, BigDecimal amount) {
        return new LedgerLeg(accountId, currency, amount, LegType.CREDIT);
    }

    public static LedgerLeg debit(UUID accountId, String currency, BigDecimal amount) {
        return new LedgerLeg(accountId, currency, amount, LegType.DEBIT);
    }

    public static LedgerLeg lock(UUID accountId, String currency, BigDecimal amount) {
        return new LedgerLeg(accountId, currency, amount, LegType.LOCK);
    }

    public static LedgerLeg unlock(UUID accountId, String currency, BigDecimal amount) {
        return new LedgerLeg(accountId, currency, amount, LegType.UNLOCK);
    }

    public static LedgerLeg settleLocked(UUID accountId, String currency, BigDecimal amount) {
        return new LedgerLeg(accountId, currency, amount, LegType.SETTLE_LOCKED);
    }

    public WalletKey walletKey() {
        return new WalletKey(accountId, currency);
    }

    /**
     * Signed change this leg makes to what the account owns in its currency.
     */
    public BigDecimal ownedChange() {
        return amount.multiply(BigDecimal.valueOf(type.ownedDirection()));
    }
}
