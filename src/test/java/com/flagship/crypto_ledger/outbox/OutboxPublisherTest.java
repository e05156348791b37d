package com.flagship.crypto_ledger.outbox;

import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.observability.CorrelationContext;
import com.flagship.crypto_ledger.offer.EscrowService;
import com.flagship.crypto_ledger.offer.TradeOffer;
import com.flagship.crypto_ledger.support.TestClockConfig;
import com.flagship.crypto_ledger.support.TestContainerProperties;
import com.flagship.crypto_ledger.trading.MarketOrderExecutor;
import com.flagship.crypto_ledger.trading.MarketOrderRequest;
import com.flagship.crypto_ledger.trading.OrderSide;
import com.flagship.crypto_ledger.trading.TradeTransaction;
import com.flagship.crypto_ledger.trading.TradingPair;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox publisher against a real broker: events reach the topic of their
 * aggregate, keyed by aggregate id, and are marked published.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@Import(TestClockConfig.class)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = TestContainerProperties.postgres();

    @Container
    static KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        TestContainerProperties.register(registry, postgres);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("kafka.topics.auto-create", () -> "true");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AccountRegistry accountRegistry;

    @Autowired
    private MarketOrderExecutor orderExecutor;

    @Autowired
    private EscrowService escrowService;

    @Value("${kafka.topic.accounts:accounts}")
    private String accountsTopic;

    @Value("${kafka.topic.orders:orders}")
    private String ordersTopic;

    @Value("${kafka.topic.offers:offers}")
    private String offersTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of(accountsTopic, ordersTopic, offersTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
        CorrelationContext.clear();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("SUCCESS: " + message);
    }

    private int drainOutbox() {
        int total = 0;
        int published;
        do {
            published = outboxPublisher.triggerPublish();
            total += published;
        } while (published > 0);
        return total;
    }

    private List<ConsumerRecord<String, String>> consumeRecordsWithKey(String key, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline && matching.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(200));
            for (ConsumerRecord<String, String> record : records) {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            }
        }
        return matching;
    }

    @Test
    @DisplayName("Account and order events reach their topics keyed by aggregate id")
    void testPublisher_SendsToKafka() {
        printTestHeader("Publisher Sends Events to Kafka");

        CorrelationContext.setCorrelationId("kafka-run");
        UUID accountId = accountRegistry.resolveOrCreate("kafka-" + UUID.randomUUID(), "Publisher").getAccount().getId();
        TradeTransaction tx = orderExecutor.execute(MarketOrderRequest.builder()
            .accountId(accountId)
            .pair(new TradingPair("BTC", "USDT"))
            .side(OrderSide.BUY)
            .amount(new BigDecimal("0.01"))
            .price(new BigDecimal("50000"))
            .build());

        assertTrue(outboxPublisher.getUnpublishedCount() >= 2);
        assertTrue(drainOutbox() >= 2);
        assertEquals(0, outboxService.countUnpublished(), "All events should be published");

        List<ConsumerRecord<String, String>> accountRecords = consumeRecordsWithKey(accountId.toString(), 1, 10000);
        assertEquals(1, accountRecords.size());
        assertEquals(accountsTopic, accountRecords.get(0).topic());

        List<ConsumerRecord<String, String>> orderRecords = consumeRecordsWithKey(tx.getId().toString(), 1, 10000);
        assertEquals(1, orderRecords.size());
        assertEquals(ordersTopic, orderRecords.get(0).topic());
        assertEquals("OrderExecuted", new String(
            orderRecords.get(0).headers().lastHeader(OutboxPublisher.EVENT_TYPE_HEADER).value(), StandardCharsets.UTF_8));
        assertEquals("kafka-run", new String(
            orderRecords.get(0).headers().lastHeader(OutboxPublisher.CORRELATION_ID_HEADER).value(), StandardCharsets.UTF_8));

        outboxService.getEventsForAggregate("Order", tx.getId())
            .forEach(event -> assertTrue(event.isPublished()));

        printSuccess("Events published to Kafka and marked as published");
    }

    @Test
    @DisplayName("Offer lifecycle events share a key and keep their order")
    void testPublisher_OfferEventsInOrder() {
        printTestHeader("Offer Events In Order");

        UUID creator = accountRegistry.resolveOrCreate("kafka-" + UUID.randomUUID(), "Maker").getAccount().getId();
        TradeOffer offer = escrowService.createOffer(creator, "USDT", new BigDecimal("100"), "BTC", new BigDecimal("0.002"));
        escrowService.cancelOffer(creator, offer.getId());

        drainOutbox();

        List<ConsumerRecord<String, String>> records = consumeRecordsWithKey(offer.getId().toString(), 2, 10000);
        assertEquals(2, records.size());
        assertEquals(records.get(0).partition(), records.get(1).partition());
        assertTrue(records.get(0).value().contains("OfferCreated"));
        assertTrue(records.get(1).value().contains("OfferCancelled"));

        printSuccess("Per-offer ordering preserved on one partition");
    }
}
