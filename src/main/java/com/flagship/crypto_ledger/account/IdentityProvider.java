package com.flagship.crypto_ledger.account;

/**
 * Source of the caller's external identity (OAuth session, proxy headers, test fixture).
 */
@FunctionalInterface
public interface IdentityProvider {

    /**
     * @throws com.flagship.crypto_ledger.exception.InvalidOperationException if no identity is present
     */
    ExternalIdentity authenticate();
}
