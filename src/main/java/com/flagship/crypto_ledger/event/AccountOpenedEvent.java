package com.flagship.crypto_ledger.event;

import com.flagship.crypto_ledger.account.Account;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A new account exists, with every wallet opened and the base currency seeded.
 */
@Value
public class AccountOpenedEvent implements TradingEvent {
    UUID eventId;
    UUID accountId;
    String externalId;
    String displayName;
    String seedCurrency;
    BigDecimal seedAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountOpened";

    public static AccountOpenedEvent of(Account account, String seedCurrency, BigDecimal seedAmount, Instant now) {
        return new AccountOpenedEvent(UUID.randomUUID(), account.getId(), account.getExternalId(),
            account.getDisplayName(), seedCurrency, seedAmount, now);
    }

    @Override
    public UUID getAggregateId() {
        return accountId;
    }

    @Override
    public String getAggregateType() {
        return "Account";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
