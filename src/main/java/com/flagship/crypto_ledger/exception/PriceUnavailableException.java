package com.flagship.crypto_ledger.exception;

public class PriceUnavailableException extends LedgerException {

    public PriceUnavailableException(String pair) {
        super("PriceUnavailable", "No price available for " + pair);
    }
}
