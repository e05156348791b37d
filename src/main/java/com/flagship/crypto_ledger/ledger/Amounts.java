package com.flagship.crypto_ledger.ledger;

import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.exception.InvalidOperationException;

import java.math.BigDecimal;

/**
 * Validation for amounts entering the ledger.
 */
public final class Amounts {

    /**
     * Exclusive upper bound of NUMERIC(28,8): 20 integer digits.
     */
    public static final BigDecimal STORAGE_LIMIT = new BigDecimal("1E+20");

    private Amounts() {
    }

    /**
     * Rejects null, zero, negative, over-precise and unstorable amounts.
     *
     * @return the amount at the storage scale
     */
    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        if (amount == null) {
            throw new InvalidOperationException(field + " is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidOperationException(field + " must be greater than zero: " + amount.toPlainString());
        }
        if (amount.stripTrailingZeros().scale() > TradingSettings.AMOUNT_SCALE) {
            throw new InvalidOperationException(String.format(
                "%s supports at most %d decimal places: %s", field, TradingSettings.AMOUNT_SCALE, amount.toPlainString()));
        }
        requireStorable(amount, field);
        return amount.setScale(TradingSettings.AMOUNT_SCALE);
    }

    /**
     * @throws InvalidOperationException if the value does not fit a NUMERIC(28,8) column
     */
    public static BigDecimal requireStorable(BigDecimal value, String field) {
        if (value.abs().compareTo(STORAGE_LIMIT) >= 0) {
            throw new InvalidOperationException(String.format(
                "%s exceeds the supported maximum of %s: %s",
                field, STORAGE_LIMIT.toPlainString(), value.toPlainString()));
        }
        return value;
    }
}
