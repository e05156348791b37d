package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.exception.InvalidOperationException;

import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    public static OrderSide parse(String value) {
        if (value == null) {
            throw new InvalidOperationException("Order side is required");
        }
        try {
            return OrderSide.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidOperationException("Order side must be buy or sell: " + value);
        }
    }
}
