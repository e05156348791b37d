package com.flagship.crypto_ledger.portfolio;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One currency of a portfolio. price is null when the currency has no price, and value is then 0.
 */
@Value
public class HoldingValue {
    String currency;
    BigDecimal balance;
    BigDecimal lockedBalance;
    BigDecimal price;
    BigDecimal value;
}
