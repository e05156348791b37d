package com.flagship.crypto_ledger.account;

import lombok.Value;

/**
 * Result of resolve-or-create: the account, and whether this call created it.
 */
@Value
public class AccountResolution {
    Account account;
    boolean created;
}
