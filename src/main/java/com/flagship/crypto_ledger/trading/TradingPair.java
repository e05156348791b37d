package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.exception.InvalidOperationException;
import lombok.Value;

import java.util.Locale;

/**
 * base/quote, e.g. BTC/USDT: one BTC is priced in USDT.
 * A buy spends quote and receives base; a sell does the reverse.
 */
@Value
public class TradingPair {
    String base;
    String quote;

    public TradingPair(String base, String quote) {
        if (base == null || base.isBlank() || quote == null || quote.isBlank()) {
            throw new InvalidOperationException("Pair needs both a base and a quote currency");
        }
        this.base = base.trim().toUpperCase(Locale.ROOT);
        this.quote = quote.trim().toUpperCase(Locale.ROOT);
        if (this.base.equals(this.quote)) {
            throw new InvalidOperationException("Pair currencies must differ: " + this.base + "/" + this.quote);
        }
    }

    /**
     * Accepts BTC/USDT and BTC-USDT, any case.
     */
    public static TradingPair parse(String symbol) {
        if (symbol == null) {
            throw new InvalidOperationException("Pair is required");
        }
        String[] parts = symbol.trim().split("[/\\-]");
        if (parts.length != 2) {
            throw new InvalidOperationException("Pair must look like BASE/QUOTE: " + symbol);
        }
        return new TradingPair(parts[0], parts[1]);
    }

    public String symbol() {
        return base + "/" + quote;
    }

    @Override
    public String toString() {
        return symbol();
    }
}
