package com.flagship.crypto_ledger.observability;

import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.exception.StorageUnavailableException;
import com.flagship.crypto_ledger.offer.EscrowReconciliationService;
import com.flagship.crypto_ledger.offer.EscrowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricsSchedulerTest {

    @Mock
    private OutboxMetrics outboxMetrics;

    @Mock
    private TradingMetrics tradingMetrics;

    @Mock
    private AccountRegistry accountRegistry;

    @Mock
    private EscrowService escrowService;

    @Mock
    private EscrowReconciliationService reconciliationService;

    private MetricsScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new MetricsScheduler(outboxMetrics, tradingMetrics, accountRegistry,
            escrowService, reconciliationService);
    }

    @Test
    @DisplayName("Escrow audit survives a transient storage failure and runs again next tick")
    void testReconcileStorageUnavailable() {
        when(reconciliationService.reconcile())
            .thenThrow(new StorageUnavailableException("lock timeout", new SQLException("timeout")))
            .thenReturn(null);

        assertDoesNotThrow(() -> scheduler.reconcileEscrow());
        assertDoesNotThrow(() -> scheduler.reconcileEscrow());

        verify(reconciliationService, times(2)).reconcile();
    }

    @Test
    @DisplayName("Escrow audit survives a raw data access failure")
    void testReconcileDataAccess() {
        when(reconciliationService.reconcile()).thenThrow(new QueryTimeoutException("timeout"));

        assertDoesNotThrow(() -> scheduler.reconcileEscrow());
    }

    @Test
    @DisplayName("Gauge refresh is skipped when storage is unavailable")
    void testRefreshStorageUnavailable() {
        when(accountRegistry.countAccounts())
            .thenThrow(new StorageUnavailableException("connection lost", new SQLException("closed")));

        assertDoesNotThrow(() -> scheduler.refreshLedgerMetrics());

        verifyNoInteractions(tradingMetrics);
    }
}
