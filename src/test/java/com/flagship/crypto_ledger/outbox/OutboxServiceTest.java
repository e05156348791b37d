package com.flagship.crypto_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.event.BonusClaimedEvent;
import com.flagship.crypto_ledger.event.OrderExecutedEvent;
import com.flagship.crypto_ledger.exception.InsufficientFundsException;
import com.flagship.crypto_ledger.observability.CorrelationContext;
import com.flagship.crypto_ledger.support.TestClockConfig;
import com.flagship.crypto_ledger.support.TestContainerProperties;
import com.flagship.crypto_ledger.trading.MarketOrderExecutor;
import com.flagship.crypto_ledger.trading.MarketOrderRequest;
import com.flagship.crypto_ledger.trading.OrderSide;
import com.flagship.crypto_ledger.trading.TradeTransaction;
import com.flagship.crypto_ledger.trading.TradingPair;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes: atomic with the ledger change, tagged with the request's
 * correlation id, and tracked through publish and failure bookkeeping.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@Import(TestClockConfig.class)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = TestContainerProperties.postgres();

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        TestContainerProperties.register(registry, postgres);
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private AccountRegistry accountRegistry;

    @Autowired
    private MarketOrderExecutor orderExecutor;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID accountId;

    @BeforeEach
    void setUp() {
        accountId = accountRegistry.resolveOrCreate("outbox-" + UUID.randomUUID(), "Outbox").getAccount().getId();
    }

    @AfterEach
    void tearDown() {
        CorrelationContext.clear();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private TradeTransaction buyBtc(String amount) {
        return orderExecutor.execute(MarketOrderRequest.builder()
            .accountId(accountId)
            .pair(new TradingPair("BTC", "USDT"))
            .side(OrderSide.BUY)
            .amount(new BigDecimal(amount))
            .price(new BigDecimal("50000"))
            .build());
    }

    private OutboxEvent orderEvent(TradeTransaction tx) {
        List<OutboxEvent> events = outboxService.getEvents(OrderExecutedEvent.EVENT_TYPE, tx.getId());
        assertEquals(1, events.size());
        return events.get(0);
    }

    @Test
    @DisplayName("Order event carries the fill and the request's correlation id")
    void testOrderEventPayload() throws Exception {
        printTestHeader("Order Event Payload");

        CorrelationContext.setCorrelationId("req-42");
        TradeTransaction tx = buyBtc("0.1");

        OutboxEvent event = orderEvent(tx);
        System.out.println("Payload: " + event.getPayload());

        assertEquals("Order", event.getAggregateType());
        assertEquals("req-42", event.getCorrelationId());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        assertNotNull(event.getSequenceNumber());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals(tx.getId().toString(), payload.get("transactionId").asText());
        assertEquals(accountId.toString(), payload.get("accountId").asText());
        assertEquals("BTC/USDT", payload.get("pair").asText());
        assertEquals("BUY", payload.get("side").asText());
        assertEquals(0, new BigDecimal("5005").compareTo(payload.get("quoteAmount").decimalValue()));
        assertEquals(0, new BigDecimal("5").compareTo(payload.get("fee").decimalValue()));
    }

    @Test
    @DisplayName("Rejected order leaves no event behind")
    void testRejectedOrderWritesNothing() {
        printTestHeader("Rejected Order Writes No Event");

        long before = outboxService.countUnpublished();

        assertThrows(InsufficientFundsException.class, () -> buyBtc("1"));

        assertEquals(before, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Saving an event outside a transaction is refused")
    void testSaveEventRequiresTransaction() {
        printTestHeader("Save Event Requires Transaction");

        BonusClaimedEvent event = new BonusClaimedEvent(UUID.randomUUID(), UUID.randomUUID(), accountId,
            "USDT", new BigDecimal("50"), Instant.now(), Instant.now());

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(event));
        assertTrue(outboxService.getEventsForAggregate("Bonus", accountId).isEmpty());
    }

    @Test
    @DisplayName("Published events leave the publishable batch")
    void testMarkPublished() {
        printTestHeader("Mark Published");

        OutboxEvent event = orderEvent(buyBtc("0.01"));
        assertTrue(outboxService.findPublishableEvents(1000, 5).stream()
            .anyMatch(e -> e.getId().equals(event.getId())));

        outboxService.markPublished(event.getId());

        assertFalse(outboxService.findPublishableEvents(1000, 5).stream()
            .anyMatch(e -> e.getId().equals(event.getId())));
        assertNotNull(outboxEventRepository.findById(event.getId()).orElseThrow().getPublishedAt());
    }

    @Test
    @DisplayName("Failures count retries, keep the last error and dead-letter at the limit")
    void testMarkFailed() {
        printTestHeader("Mark Failed");

        OutboxEvent event = orderEvent(buyBtc("0.01"));

        outboxService.markFailed(event.getId(), "Connection timeout");
        outboxService.markFailed(event.getId(), "x".repeat(5000));
        outboxService.markFailed(event.getId(), "Broker not available");

        OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
        assertEquals(3, entity.getRetryCount());
        assertEquals("Broker not available", entity.getLastError());
        assertTrue(entity.toDomain().isDeadLettered(3));

        assertFalse(outboxService.findPublishableEvents(1000, 3).stream()
            .anyMatch(e -> e.getId().equals(event.getId())));
        assertTrue(outboxEventRepository.countDeadLettered(3) >= 1);
    }

    @Test
    @DisplayName("Long broker errors are truncated")
    void testErrorTruncated() {
        printTestHeader("Error Truncated");

        OutboxEvent event = orderEvent(buyBtc("0.01"));
        outboxService.markFailed(event.getId(), "x".repeat(5000));

        assertEquals(1000, outboxEventRepository.findById(event.getId()).orElseThrow().getLastError().length());
    }
}
