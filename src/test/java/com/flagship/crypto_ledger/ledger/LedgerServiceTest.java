package com.flagship.crypto_ledger.ledger;

import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.exception.InsufficientFundsException;
import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.exception.ResourceNotFoundException;
import com.flagship.crypto_ledger.support.TestClockConfig;
import com.flagship.crypto_ledger.support.TestContainerProperties;
import org.junit.jupiter.api.BeforeEach;
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
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Multi-leg transfers: all legs commit or none do.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@Import(TestClockConfig.class)
class LedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = TestContainerProperties.postgres();

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        TestContainerProperties.register(registry, postgres);
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountRegistry accountRegistry;

    private UUID alice;
    private UUID bob;

    @BeforeEach
    void setUp() {
        alice = accountRegistry.resolveOrCreate("alice-" + UUID.randomUUID(), "Alice").getAccount().getId();
        bob = accountRegistry.resolveOrCreate("bob-" + UUID.randomUUID(), "Bob").getAccount().getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private BigDecimal balance(UUID accountId, String currency) {
        return ledgerService.getWallet(accountId, currency).getBalance();
    }

    @Test
    @DisplayName("Conserving two-account transfer moves funds and returns post-state of every wallet")
    void testPost_Conserving() {
        printTestHeader("Conserving Transfer");

        TransferRequest request = TransferRequest.of("alice pays bob",
            LedgerLeg.debit(alice, "USDT", new BigDecimal("1500")),
            LedgerLeg.credit(bob, "USDT", new BigDecimal("1500")));
        assertTrue(request.isConserving());

        Map<WalletKey, Wallet> after = ledgerService.post(request);
        printOutput("Post-state", after);

        assertEquals(2, after.size());
        assertEquals(0, new BigDecimal("8500").compareTo(after.get(new WalletKey(alice, "USDT")).getBalance()));
        assertEquals(0, new BigDecimal("11500").compareTo(after.get(new WalletKey(bob, "USDT")).getBalance()));
    }

    @Test
    @DisplayName("A failing later leg rolls back the legs already applied")
    void testPost_Atomic() {
        printTestHeader("Atomic Rollback");

        TransferRequest request = TransferRequest.of("second leg overdraws",
            LedgerLeg.credit(alice, "BTC", new BigDecimal("1")),
            LedgerLeg.debit(bob, "ETH", new BigDecimal("1")));

        assertThrows(InsufficientFundsException.class, () -> ledgerService.post(request));

        assertEquals(0, balance(alice, "BTC").signum(), "Credit leg must have been rolled back");
        assertEquals(0, balance(bob, "ETH").signum());
    }

    @Test
    @DisplayName("Invalid legs are rejected before any wallet is touched")
    void testPost_Validation() {
        assertThrows(InvalidOperationException.class, () -> ledgerService.post(
            TransferRequest.of("zero", LedgerLeg.credit(alice, "USDT", BigDecimal.ZERO))));
        assertThrows(InvalidOperationException.class, () -> ledgerService.post(
            TransferRequest.of("negative", LedgerLeg.credit(alice, "USDT", new BigDecimal("-1")))));
        assertThrows(InvalidOperationException.class, () -> ledgerService.post(
            TransferRequest.of("too precise", LedgerLeg.credit(alice, "USDT", new BigDecimal("0.000000001")))));
        assertThrows(InvalidOperationException.class, () -> ledgerService.post(
            TransferRequest.of("unknown currency", LedgerLeg.credit(alice, "XYZ", BigDecimal.ONE))));

        assertEquals(0, new BigDecimal("10000").compareTo(balance(alice, "USDT")));
    }

    @Test
    @DisplayName("Posting to an unknown account fails with ResourceNotFound")
    void testPost_UnknownAccount() {
        UUID ghost = UUID.randomUUID();
        assertThrows(ResourceNotFoundException.class, () -> ledgerService.post(
            TransferRequest.of("ghost", LedgerLeg.credit(ghost, "USDT", BigDecimal.ONE))));
        assertThrows(ResourceNotFoundException.class, () -> ledgerService.getWallets(ghost));
    }

    @Test
    @DisplayName("Currency totals count locked funds")
    void testCurrencyTotals_IncludeLocked() {
        printTestHeader("Currency Totals");

        BigDecimal before = ledgerService.currencyTotals().get("USDT");
        ledgerService.post(TransferRequest.of("escrow", LedgerLeg.lock(alice, "USDT", new BigDecimal("300"))));
        BigDecimal after = ledgerService.currencyTotals().get("USDT");
        printOutput("USDT total before/after", before + " / " + after);

        assertEquals(0, before.compareTo(after));
    }
}
