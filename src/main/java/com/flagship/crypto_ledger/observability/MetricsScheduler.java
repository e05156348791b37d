package com.flagship.crypto_ledger.observability;

import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.exception.StorageUnavailableException;
import com.flagship.crypto_ledger.offer.EscrowReconciliationService;
import com.flagship.crypto_ledger.offer.EscrowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic read-only jobs: gauge refresh and the escrow audit.
 * Gauges that need a query are refreshed here rather than on every scrape.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final TradingMetrics tradingMetrics;
    private final AccountRegistry accountRegistry;
    private final EscrowService escrowService;
    private final EscrowReconciliationService reconciliationService;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshLedgerMetrics() {
        try {
            tradingMetrics.updateLedgerGauges(accountRegistry.countAccounts(), escrowService.countActiveOffers());
        } catch (DataAccessException | StorageUnavailableException e) {
            log.warn("Failed to refresh ledger metrics: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${ledger.reconciliation.interval:60000}",
               initialDelayString = "${ledger.reconciliation.initial-delay:30000}")
    public void reconcileEscrow() {
        try {
            reconciliationService.reconcile();
        } catch (DataAccessException | StorageUnavailableException e) {
            log.warn("Escrow reconciliation skipped: {}", e.getMessage());
        }
    }
}
