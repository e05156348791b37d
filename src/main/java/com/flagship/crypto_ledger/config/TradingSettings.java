package com.flagship.crypto_ledger.config;

import com.flagship.crypto_ledger.exception.InvalidOperationException;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Game-wide trading constants.
 *
 * Every account holds one wallet per supported currency. The base currency is
 * the unit of portfolio value and is the only currency that receives the initial
 * seed and the daily bonus.
 */
@Component
@Getter
public class TradingSettings {

    /**
     * Scale of every stored amount (NUMERIC(28,8)).
     */
    public static final int AMOUNT_SCALE = 8;

    private final String baseCurrency;
    private final Set<String> currencies;
    private final BigDecimal initialBalance;
    private final BigDecimal feeRate;
    private final BigDecimal bonusAmount;
    private final Duration bonusCooldown;

    public TradingSettings(
            @Value("${trading.base-currency:USDT}") String baseCurrency,
            @Value("${trading.currencies:BTC,ETH,OP,BNB,SOL,DOGE,TRX,USDT,XRP,ADA,NEAR,LTC,BCH,XLM,LINK,MATIC}")
            List<String> currencies,
            @Value("${trading.initial-balance:10000}") BigDecimal initialBalance,
            @Value("${trading.fee-rate:0.001}") BigDecimal feeRate,
            @Value("${trading.bonus.amount:50}") BigDecimal bonusAmount,
            @Value("${trading.bonus.cooldown:PT24H}") Duration bonusCooldown) {

        Set<String> normalized = new LinkedHashSet<>();
        for (String currency : currencies) {
            normalized.add(normalize(currency));
        }

        this.baseCurrency = normalize(baseCurrency);
        this.currencies = Collections.unmodifiableSet(normalized);
        this.initialBalance = initialBalance;
        this.feeRate = feeRate;
        this.bonusAmount = bonusAmount;
        this.bonusCooldown = bonusCooldown;

        if (!this.currencies.contains(this.baseCurrency)) {
            throw new IllegalStateException(
                "Base currency " + this.baseCurrency + " is not in the supported currency list " + this.currencies);
        }
        if (feeRate.signum() < 0 || feeRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalStateException("Fee rate must be in [0, 1): " + feeRate);
        }
        if (initialBalance.signum() < 0 || bonusAmount.signum() <= 0) {
            throw new IllegalStateException(
                "Initial balance must be >= 0 and bonus amount > 0: initial=" + initialBalance + ", bonus=" + bonusAmount);
        }
        if (bonusCooldown.isNegative() || bonusCooldown.isZero()) {
            throw new IllegalStateException("Bonus cooldown must be positive: " + bonusCooldown);
        }
    }

    public boolean isSupported(String currency) {
        return currency != null && currencies.contains(normalize(currency));
    }

    /**
     * Normalizes a currency symbol and rejects anything the game does not list.
     */
    public String requireSupported(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new InvalidOperationException("Currency is required");
        }
        String symbol = normalize(currency);
        if (!currencies.contains(symbol)) {
            throw new InvalidOperationException("Unsupported currency: " + currency);
        }
        return symbol;
    }

    public boolean isBaseCurrency(String currency) {
        return baseCurrency.equals(currency);
    }

    private static String normalize(String currency) {
        return currency.trim().toUpperCase(Locale.ROOT);
    }
}
