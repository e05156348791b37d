package com.flagship.crypto_ledger.exception;

/**
 * Base type for every failure the ledger reports to its callers.
 *
 * The error code is the stable, client-facing name of the failure
 * (InsufficientFunds, OfferNotActive, ...). Messages are for humans and may change.
 */
public abstract class LedgerException extends RuntimeException {

    private final String errorCode;

    protected LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
