package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.ledger.LedgerService;
import com.flagship.crypto_ledger.observability.TradingMetrics;
import com.flagship.crypto_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketOrderExecutorMetricsTest {

    @Mock
    private LedgerService ledgerService;

    @Mock
    private TradeTransactionRepository transactionRepository;

    @Mock
    private OutboxService outboxService;

    private SimpleMeterRegistry registry;
    private MarketOrderExecutor executor;

    @BeforeEach
    void setUp() {
        TradingSettings settings = new TradingSettings("USDT", List.of("BTC", "ETH", "USDT"),
            new BigDecimal("10000"), new BigDecimal("0.001"), new BigDecimal("50"), Duration.ofHours(24));
        registry = new SimpleMeterRegistry();
        executor = new MarketOrderExecutor(ledgerService, transactionRepository, outboxService, settings,
            new TradingMetrics(registry), Clock.fixed(Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC));
    }

    private MarketOrderRequest order(String pair) {
        return MarketOrderRequest.builder()
            .accountId(UUID.randomUUID())
            .pair(TradingPair.parse(pair))
            .side(OrderSide.BUY)
            .amount(BigDecimal.ONE)
            .price(BigDecimal.TEN)
            .build();
    }

    @Test
    @DisplayName("Rejected orders for unconfigured pairs share a single pair=invalid counter")
    void testUnsupportedPairsCollapse() {
        for (int i = 0; i < 50; i++) {
            MarketOrderRequest request = order("X" + i + "/USDT");
            assertThrows(InvalidOperationException.class, () -> executor.execute(request));
        }

        Collection<Counter> counters = registry.find("trading.orders").counters();
        assertEquals(1, counters.size());
        Counter counter = counters.iterator().next();
        assertEquals("invalid", counter.getId().getTag("pair"));
        assertEquals("BUY", counter.getId().getTag("side"));
        assertEquals("InvalidOperation", counter.getId().getTag("status"));
        assertEquals(50.0, counter.count());
        verifyNoInteractions(ledgerService, transactionRepository, outboxService);
    }

    @Test
    @DisplayName("Rejected orders for configured pairs keep their pair tag")
    void testSupportedPairKeepsTag() {
        MarketOrderRequest tooLarge = MarketOrderRequest.builder()
            .accountId(UUID.randomUUID())
            .pair(TradingPair.parse("eth/usdt"))
            .side(OrderSide.SELL)
            .amount(new BigDecimal("1E+21"))
            .price(BigDecimal.TEN)
            .build();

        assertThrows(InvalidOperationException.class, () -> executor.execute(tooLarge));

        assertEquals(1.0, registry.get("trading.orders")
            .tags("pair", "ETH/USDT", "side", "SELL", "status", "InvalidOperation").counter().count());
        verifyNoInteractions(ledgerService);
    }
}
