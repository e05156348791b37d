package com.flagship.crypto_ledger.account;

import lombok.Value;

/**
 * Who the identity provider says the caller is. Opaque to the ledger.
 */
@Value
public class ExternalIdentity {
    String externalId;
    String displayName;
}
