package com.flagship.crypto_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Micrometer meters for ledger operations.
 *
 * - trading.orders{pair, side, status}
 * - trading.offers{action, status}
 * - trading.bonus.claims{result}
 * - trading.fees.burned{currency}: fees removed from circulation
 * - trading.latency{operation}
 * - ledger.accounts, ledger.offers.active: gauges refreshed by {@link MetricsScheduler}
 */
@Component
public class TradingMetrics {

    private final MeterRegistry registry;

    private final AtomicLong accountCount = new AtomicLong(0);
    private final AtomicLong activeOfferCount = new AtomicLong(0);

    public TradingMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("ledger.accounts", accountCount, AtomicLong::get)
                .description("Number of accounts")
                .register(registry);

        Gauge.builder("ledger.offers.active", activeOfferCount, AtomicLong::get)
                .description("Number of offers currently holding escrowed funds")
                .register(registry);
    }

    public void recordOrder(String pair, String side, String status) {
        registry.counter("trading.orders",
                "pair", sanitizeTag(pair),
                "side", sanitizeTag(side),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordOffer(String action, String status) {
        registry.counter("trading.offers",
                "action", sanitizeTag(action),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordBonusClaim(String result) {
        registry.counter("trading.bonus.claims", "result", sanitizeTag(result)).increment();
    }

    public void recordFeeBurned(String currency, BigDecimal fee) {
        if (fee.signum() > 0) {
            registry.counter("trading.fees.burned", "currency", sanitizeTag(currency))
                    .increment(fee.doubleValue());
        }
    }

    /**
     * Times an operation, success or failure.
     */
    public <T> T time(String operation, Supplier<T> action) {
        Timer timer = Timer.builder("trading.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        return timer.record(action);
    }

    public void updateLedgerGauges(long accounts, long activeOffers) {
        accountCount.set(accounts);
        activeOfferCount.set(activeOffers);
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_/]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
