package com.flagship.crypto_ledger.trading;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Current unit prices. Always consulted before a ledger transaction starts,
 * never inside one.
 */
public interface PriceOracle {

    /**
     * Price of one unit of pair.base in pair.quote, or empty if unknown.
     */
    Optional<BigDecimal> price(TradingPair pair);

    /**
     * Price of every known currency in the base currency; the base currency maps to 1.
     */
    Map<String, BigDecimal> referencePrices();
}
