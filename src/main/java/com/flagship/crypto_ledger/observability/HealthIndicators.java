package com.flagship.crypto_ledger.observability;

import com.flagship.crypto_ledger.offer.EscrowReconciliationService;
import com.flagship.crypto_ledger.offer.ReconciliationReport;
import com.flagship.crypto_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Actuator health contributors for the ledger.
 */
public class HealthIndicators {

    /**
     * DOWN once the outbox backlog passes the critical threshold. Dead letters
     * never block publishing, so they are reported without changing the status.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                Health.Builder builder = backlog < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlog < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlog)
                        .withDetail("deadLetters", outboxRepository.countDeadLettered(maxRetries))
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * DOWN while the last escrow audit found drift; UNKNOWN before the first audit.
     */
    @Component("escrowReconciliationHealth")
    public static class EscrowReconciliationHealthIndicator implements HealthIndicator {

        private final EscrowReconciliationService reconciliationService;

        public EscrowReconciliationHealthIndicator(EscrowReconciliationService reconciliationService) {
            this.reconciliationService = reconciliationService;
        }

        @Override
        public Health health() {
            Optional<ReconciliationReport> last = reconciliationService.getLastReport();
            if (last.isEmpty()) {
                return Health.unknown().withDetail("reason", "no reconciliation has run yet").build();
            }
            ReconciliationReport report = last.get();
            Health.Builder builder = report.isClean() ? Health.up() : Health.down();
            builder.withDetail("checkedAt", report.getCheckedAt().toString())
                    .withDetail("walletsChecked", report.getWalletsChecked())
                    .withDetail("drifts", report.getDrifts().size());
            if (!report.isClean()) {
                builder.withDetail("firstDrift", report.getDrifts().get(0).toString());
            }
            return builder.build();
        }
    }
}
