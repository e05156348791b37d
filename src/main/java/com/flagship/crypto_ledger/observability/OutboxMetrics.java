package com.flagship.crypto_ledger.observability;

import com.flagship.crypto_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges: pending events per aggregate type, oldest pending age and dead letters.
 * Values are cached and refreshed by {@link MetricsScheduler}, not queried per scrape.
 */
@Component
@Slf4j
public class OutboxMetrics {

    static final List<String> AGGREGATE_TYPES = List.of("Account", "Order", "Offer", "Bonus");

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final Map<String, AtomicLong> backlogByAggregate = new LinkedHashMap<>();
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;
        AGGREGATE_TYPES.forEach(type -> backlogByAggregate.put(type, new AtomicLong()));
    }

    @PostConstruct
    public void init() {
        backlogByAggregate.forEach((type, pending) ->
            Gauge.builder("outbox.backlog.size", pending, AtomicLong::get)
                .description("Unpublished events waiting in the outbox")
                .tag("aggregate_type", type)
                .register(meterRegistry));

        Gauge.builder("outbox.backlog.age.seconds", oldestPendingAgeSeconds, AtomicLong::get)
            .description("Age of the oldest unpublished event")
            .register(meterRegistry);

        Gauge.builder("outbox.events.dead_letters", deadLettered, AtomicLong::get)
            .description("Unpublished events that used up their retries")
            .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (Object[] row : outboxRepository.countUnpublishedByAggregateType()) {
                counts.put((String) row[0], ((Number) row[1]).longValue());
            }
            backlogByAggregate.forEach((type, pending) -> pending.set(counts.getOrDefault(type, 0L)));

            long age = outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                .orElse(0L);
            oldestPendingAgeSeconds.set(age);
            deadLettered.set(outboxRepository.countDeadLettered(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLetters={}",
                counts, age, deadLettered.get());
        } catch (DataAccessException e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }
}
