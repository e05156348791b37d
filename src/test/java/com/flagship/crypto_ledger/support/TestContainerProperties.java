package com.flagship.crypto_ledger.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Property wiring shared by the database-backed tests. Kafka is pointed at a
 * closed port and the publisher is off, so events stay in the outbox.
 */
public final class TestContainerProperties {

    private TestContainerProperties() {
    }

    public static PostgreSQLContainer<?> postgres() {
        return new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("crypto_ledger_test")
            .withUsername("test")
            .withPassword("test");
    }

    public static void register(DynamicPropertyRegistry registry, PostgreSQLContainer<?> postgres) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("kafka.topics.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("ledger.reconciliation.initial-delay", () -> "3600000");
        registry.add("metrics.refresh.interval", () -> "3600000");
    }
}
