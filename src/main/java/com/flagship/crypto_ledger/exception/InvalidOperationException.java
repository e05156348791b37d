package com.flagship.crypto_ledger.exception;

/**
 * The request itself is not acceptable: self-trade, non-positive amount,
 * same-currency offer, unsupported currency, too many decimals.
 */
public class InvalidOperationException extends LedgerException {

    public InvalidOperationException(String message) {
        super("InvalidOperation", message);
    }
}
