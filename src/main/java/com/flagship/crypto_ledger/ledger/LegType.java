package com.flagship.crypto_ledger.ledger;

/**
 * The balance movements a single ledger leg can make on one wallet.
 */
public enum LegType {
    /** balance += amount */
    CREDIT,
    /** balance -= amount, fails with InsufficientFunds below zero */
    DEBIT,
    /** balance -> locked_balance, fails with InsufficientFunds */
    LOCK,
    /** locked_balance -> balance, fails with InvariantViolation */
    UNLOCK,
    /** locked_balance -= amount (escrowed funds leave the account), fails with InvariantViolation */
    SETTLE_LOCKED;

    /**
     * Effect of this leg on balance + locked_balance, per unit of amount.
     */
    int ownedDirection() {
        return switch (this) {
            case CREDIT -> 1;
            case DEBIT, SETTLE_LOCKED -> -1;
            case LOCK, UNLOCK -> 0;
        };
    }
}
