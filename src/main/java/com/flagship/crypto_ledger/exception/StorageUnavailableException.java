package com.flagship.crypto_ledger.exception;

/**
 * Transient storage failure (connection loss, lock timeout, deadlock victim).
 * The transaction was rolled back as a whole, so the caller may retry.
 */
public class StorageUnavailableException extends LedgerException {

    public StorageUnavailableException(String message, Throwable cause) {
        super("StorageUnavailable", message, cause);
    }
}
