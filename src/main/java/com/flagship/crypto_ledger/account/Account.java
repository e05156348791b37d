package com.flagship.crypto_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A player of the game, created once per external identity and never deleted.
 */
@Value
public class Account {
    UUID id;
    String externalId;
    String displayName;
    Instant lastBonusClaim;    // null until the first bonus
    Instant createdAt;
}
