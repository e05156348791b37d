package com.flagship.crypto_ledger.exception;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A debit, lock or escrow leg would take a wallet below zero. Nothing was applied.
 */
public class InsufficientFundsException extends LedgerException {

    private final UUID accountId;
    private final String currency;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientFundsException(UUID accountId, String currency, BigDecimal required, BigDecimal available) {
        super("InsufficientFunds", String.format(
            "Insufficient %s balance for account %s: required=%s, available=%s",
            currency, accountId, required.toPlainString(), available.toPlainString()));
        this.accountId = accountId;
        this.currency = currency;
        this.required = required;
        this.available = available;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getRequired() {
        return required;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
