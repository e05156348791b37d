package com.flagship.crypto_ledger.exception;

import java.util.UUID;

public class ResourceNotFoundException extends LedgerException {

    public ResourceNotFoundException(String resource, UUID id) {
        super("NotFound", resource + " not found: " + id);
    }

    public static ResourceNotFoundException account(UUID accountId) {
        return new ResourceNotFoundException("Account", accountId);
    }

    public static ResourceNotFoundException offer(UUID offerId) {
        return new ResourceNotFoundException("Offer", offerId);
    }
}
