package com.flagship.crypto_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.crypto_ledger.event.TradingEvent;
import com.flagship.crypto_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes trading events to the outbox inside the caller's transaction.
 *
 * An order, settlement or bonus credit and its event commit or roll back
 * together. Publishing happens later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Records the event with the correlation id of the request that produced it.
     * Requires an active transaction: a standalone event could describe a change that never committed.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(TradingEvent event) {
        OutboxEvent pending = OutboxEvent.create(event.getAggregateType(), event.getAggregateId(),
            event.getEventType(), toJson(event), CorrelationContext.getCorrelationId(), clock.instant());
        repository.save(OutboxEventEntity.pending(pending));

        log.debug("Queued {} for {} {}", event.getEventType(), event.getAggregateType(), event.getAggregateId());
        return pending;
    }

    /**
     * Runs in its own transaction so the row locks are released once the batch is read.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.lockNextBatch(limit, maxRetries).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> entity.markPublished(clock.instant()));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            log.warn("Outbox event {} failed, attempt {}: {}", eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEvents(String eventType, UUID aggregateId) {
        return repository.findByEventTypeAndAggregateIdOrderBySequenceNumberAsc(eventType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String toJson(TradingEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.getEventType(), e);
        }
    }
}
