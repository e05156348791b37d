package com.flagship.crypto_ledger.offer;

public enum OfferStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED
}
