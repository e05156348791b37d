package com.flagship.crypto_ledger.ledger;

import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.bonus.BonusService;
import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.exception.InsufficientFundsException;
import com.flagship.crypto_ledger.offer.EscrowService;
import com.flagship.crypto_ledger.offer.TradeOffer;
import com.flagship.crypto_ledger.support.TestClockConfig;
import com.flagship.crypto_ledger.support.TestContainerProperties;
import com.flagship.crypto_ledger.trading.MarketOrderExecutor;
import com.flagship.crypto_ledger.trading.MarketOrderRequest;
import com.flagship.crypto_ledger.trading.OrderSide;
import com.flagship.crypto_ledger.trading.TradeTransaction;
import com.flagship.crypto_ledger.trading.TradeTransactionEntity;
import com.flagship.crypto_ledger.trading.TradeTransactionRepository;
import com.flagship.crypto_ledger.trading.TradingPair;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Value only enters through seeding and bonuses and only leaves through fees.
 * Every other operation moves balances between wallets or between free and locked.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@Import(TestClockConfig.class)
class LedgerConservationTest {

    private static final BigDecimal BTC_PRICE = new BigDecimal("43210.12345678");
    private static final BigDecimal ETH_PRICE = new BigDecimal("2345.6789");

    @Container
    static PostgreSQLContainer<?> postgres = TestContainerProperties.postgres();

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        TestContainerProperties.register(registry, postgres);
    }

    @Autowired
    private AccountRegistry accountRegistry;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private MarketOrderExecutor executor;

    @Autowired
    private EscrowService escrowService;

    @Autowired
    private BonusService bonusService;

    @Autowired
    private TradeTransactionRepository transactionRepository;

    @Autowired
    private TradingSettings settings;

    @Autowired
    private MeterRegistry meterRegistry;

    private UUID openAccount(String name) {
        return accountRegistry.resolveOrCreate(name + "-" + UUID.randomUUID(), name).getAccount().getId();
    }

    private void order(UUID accountId, String pair, OrderSide side, String amount, BigDecimal price) {
        executor.execute(MarketOrderRequest.builder()
            .accountId(accountId)
            .pair(TradingPair.parse(pair))
            .side(side)
            .amount(new BigDecimal(amount))
            .price(price)
            .build());
    }

    private static void assertAmount(BigDecimal expected, BigDecimal actual, String currency) {
        assertEquals(0, expected.compareTo(actual), currency + ": expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Currency totals equal seeds plus bonuses plus credits minus debits after a mixed sequence")
    void testMixedSequenceConserves() {
        UUID alice = openAccount("alice");
        UUID bob = openAccount("bob");
        UUID carol = openAccount("carol");

        order(alice, "BTC/USDT", OrderSide.BUY, "0.03333333", BTC_PRICE);
        order(alice, "ETH/USDT", OrderSide.BUY, "0.7", ETH_PRICE);
        order(bob, "BTC/USDT", OrderSide.BUY, "0.01", BTC_PRICE);
        order(alice, "BTC/USDT", OrderSide.SELL, "0.01111111", BTC_PRICE);
        order(bob, "BTC/ETH", OrderSide.SELL, "0.005", BTC_PRICE.divide(ETH_PRICE, 8, RoundingMode.HALF_EVEN));
        order(carol, "ETH/USDT", OrderSide.BUY, "0.00000001", new BigDecimal("0.12345678"));
        assertThrows(InsufficientFundsException.class,
            () -> order(carol, "BTC/USDT", OrderSide.SELL, "1", BTC_PRICE));

        TradeOffer accepted = escrowService.createOffer(alice, "ETH", new BigDecimal("0.2"), "USDT", new BigDecimal("470"));
        escrowService.acceptOffer(bob, accepted.getId());
        TradeOffer cancelled = escrowService.createOffer(bob, "BTC", new BigDecimal("0.001"), "ETH", new BigDecimal("0.02"));
        escrowService.cancelOffer(bob, cancelled.getId());
        escrowService.createOffer(carol, "USDT", new BigDecimal("1234.5"), "BTC", new BigDecimal("0.02"));

        int bonuses = 0;
        for (UUID accountId : new UUID[]{alice, carol}) {
            bonusService.claim(accountId);
            bonuses++;
        }

        Map<String, BigDecimal> expected = new HashMap<>();
        expected.put(settings.getBaseCurrency(), settings.getInitialBalance()
            .multiply(BigDecimal.valueOf(accountRegistry.countAccounts()))
            .add(settings.getBonusAmount().multiply(BigDecimal.valueOf(bonuses))));

        BigDecimal feeSum = BigDecimal.ZERO;
        for (TradeTransactionEntity row : transactionRepository.findAll()) {
            TradeTransaction tx = row.toDomain();
            String base = tx.getPair().getBase();
            String quote = tx.getPair().getQuote();
            if (tx.getSide() == OrderSide.BUY) {
                expected.merge(quote, tx.getQuoteAmount().negate(), BigDecimal::add);
                expected.merge(base, tx.getAmount(), BigDecimal::add);
            } else {
                expected.merge(base, tx.getAmount().negate(), BigDecimal::add);
                expected.merge(quote, tx.getQuoteAmount(), BigDecimal::add);
            }
            feeSum = feeSum.add(tx.getFee());
        }

        Map<String, BigDecimal> totals = ledgerService.currencyTotals();
        for (Map.Entry<String, BigDecimal> entry : expected.entrySet()) {
            assertAmount(entry.getValue(), totals.getOrDefault(entry.getKey(), BigDecimal.ZERO), entry.getKey());
        }
        for (Map.Entry<String, BigDecimal> entry : totals.entrySet()) {
            assertAmount(expected.getOrDefault(entry.getKey(), BigDecimal.ZERO), entry.getValue(), entry.getKey());
        }

        double burned = meterRegistry.find("trading.fees.burned").counters().stream()
            .mapToDouble(Counter::count)
            .sum();
        assertTrue(feeSum.signum() > 0);
        assertEquals(feeSum.doubleValue(), burned, 1e-6);
    }
}
