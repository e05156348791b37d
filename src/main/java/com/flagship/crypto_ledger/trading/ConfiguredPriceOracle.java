package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.ledger.Amounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process oracle backed by reference prices in the base currency.
 *
 * Seeded from trading.oracle.prices.&lt;CURRENCY&gt; and updatable at runtime.
 * Any pair between priced currencies is derived through the base currency:
 * X/base = p(X), base/X = 1 / p(X), X/Y = p(X) / p(Y).
 */
@Component
@Slf4j
public class ConfiguredPriceOracle implements PriceOracle {

    private static final int DIVISION_SCALE = 16;

    private final TradingSettings settings;
    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

    public ConfiguredPriceOracle(Environment environment, TradingSettings settings) {
        this.settings = settings;
        Map<String, BigDecimal> configured = Binder.get(environment)
            .bind("trading.oracle.prices", Bindable.mapOf(String.class, BigDecimal.class))
            .orElse(Map.of());
        configured.forEach(this::updatePrice);
        log.info("Price oracle seeded with {} reference prices in {}", prices.size(), settings.getBaseCurrency());
    }

    @Override
    public Optional<BigDecimal> price(TradingPair pair) {
        Optional<BigDecimal> base = referencePrice(pair.getBase());
        Optional<BigDecimal> quote = referencePrice(pair.getQuote());
        if (base.isEmpty() || quote.isEmpty()) {
            return Optional.empty();
        }
        if (settings.isBaseCurrency(pair.getQuote())) {
            return base;
        }
        return Optional.of(base.get()
            .divide(quote.get(), DIVISION_SCALE, RoundingMode.HALF_EVEN)
            .stripTrailingZeros());
    }

    @Override
    public Map<String, BigDecimal> referencePrices() {
        Map<String, BigDecimal> snapshot = new TreeMap<>(prices);
        snapshot.put(settings.getBaseCurrency(), BigDecimal.ONE);
        return snapshot;
    }

    /**
     * Sets the base-currency price of one currency.
     *
     * @return the stored symbol
     */
    public String updatePrice(String currency, BigDecimal price) {
        String symbol = settings.requireSupported(currency);
        if (settings.isBaseCurrency(symbol)) {
            throw new InvalidOperationException("The base currency is always priced at 1");
        }
        if (price == null || price.signum() <= 0) {
            throw new InvalidOperationException("Price must be greater than zero: " + price);
        }
        Amounts.requireStorable(price, "Price");
        prices.put(symbol, price);
        log.debug("Reference price updated: {}={} {}", symbol, price.toPlainString(), settings.getBaseCurrency());
        return symbol;
    }

    private Optional<BigDecimal> referencePrice(String currency) {
        if (settings.isBaseCurrency(currency)) {
            return Optional.of(BigDecimal.ONE);
        }
        return Optional.ofNullable(prices.get(currency));
    }
}
