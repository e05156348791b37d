package com.flagship.crypto_ledger.outbox;

import com.flagship.crypto_ledger.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Drains the outbox to Kafka.
 *
 * 1. Fetches a batch of publishable events (FOR UPDATE SKIP LOCKED)
 * 2. Sends each one keyed by aggregate id, with event type, event id and
 *    correlation id as record headers, waiting for the broker ack
 * 3. Marks it published, or bumps its retry count on failure
 *
 * Events at max retries are left in place as dead letters and are no longer fetched.
 * With outbox.publisher.enabled=false the schedule does nothing and
 * {@link #triggerPublish()} drives publishing by hand.
 */
@Component
@Slf4j
public class OutboxPublisher {

    public static final String EVENT_TYPE_HEADER = "event_type";
    public static final String EVENT_ID_HEADER = "event_id";
    public static final String CORRELATION_ID_HEADER = "correlation_id";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    private final boolean enabled;
    private final int batchSize;
    private final int maxRetries;
    private final long sendTimeoutMs;

    private final String accountsTopic;
    private final String ordersTopic;
    private final String offersTopic;
    private final String bonusesTopic;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${outbox.publisher.enabled:true}") boolean enabled,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries,
                           @Value("${outbox.publisher.send-timeout-ms:10000}") long sendTimeoutMs,
                           @Value("${kafka.topic.accounts:accounts}") String accountsTopic,
                           @Value("${kafka.topic.orders:orders}") String ordersTopic,
                           @Value("${kafka.topic.offers:offers}") String offersTopic,
                           @Value("${kafka.topic.bonuses:bonuses}") String bonusesTopic) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.enabled = enabled;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.sendTimeoutMs = sendTimeoutMs;
        this.accountsTopic = accountsTopic;
        this.ordersTopic = ordersTopic;
        this.offersTopic = offersTopic;
        this.bonusesTopic = bonusesTopic;
    }

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        if (!enabled) {
            return;
        }
        drain();
    }

    /**
     * Publishes one batch regardless of the enabled flag.
     *
     * @return number of events acknowledged by Kafka
     */
    public int triggerPublish() {
        return drain();
    }

    public long getUnpublishedCount() {
        return outboxService.countUnpublished();
    }

    private int drain() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishableEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Error in outbox publisher polling loop", e);
            return 0;
        }

        if (events.isEmpty()) {
            return 0;
        }
        log.debug("Found {} unpublished events to process", events.size());

        int published = 0;
        for (OutboxEvent event : events) {
            if (publishEvent(event)) {
                published++;
            }
        }
        return published;
    }

    private boolean publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate.send(toRecord(event))
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted while waiting for broker ack");
            return false;
        } catch (Exception e) {
            recordFailure(event, e.getMessage());
            return false;
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        log.error("Failed to publish event: eventId={}, eventType={}, error={}",
            event.getId(), event.getEventType(), error);
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} reached max retries ({}), moving to dead letter. eventType={}, aggregateId={}",
                event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            topicFor(event), event.getAggregateId().toString(), event.getPayload());
        Headers headers = record.headers();
        headers.add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        headers.add(EVENT_ID_HEADER, event.getId().toString().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            headers.add(CORRELATION_ID_HEADER, event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }

    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case "Account" -> accountsTopic;
            case "Order" -> ordersTopic;
            case "Offer" -> offersTopic;
            case "Bonus" -> bonusesTopic;
            default -> throw new IllegalStateException("No topic for aggregate type " + event.getAggregateType());
        };
    }
}
