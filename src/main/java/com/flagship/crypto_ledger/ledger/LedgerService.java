package com.flagship.crypto_ledger.ledger;

import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Posts multi-leg transfers to the wallet table.
 *
 * This service enforces the core invariants:
 * 1. balance and locked_balance never go negative
 * 2. all legs of a request commit together or not at all
 * 3. wallets are row-locked in one global order before any leg is applied
 *
 * Callers decide what a transfer means (order, settlement, bonus); this class
 * only knows how to move amounts between balance columns.
 */
@Service
@Slf4j
public class LedgerService {

    private final WalletStore walletStore;
    private final TradingSettings settings;

    public LedgerService(WalletStore walletStore, TradingSettings settings) {
        this.walletStore = walletStore;
        this.settings = settings;
    }

    /**
     * Applies every leg of the request atomically.
     *
     * 1. Validates each leg (positive amount, scale, supported currency)
     * 2. Locks all touched wallets in (account, currency) order
     * 3. Applies legs in request order; the first failing leg rolls back the rest
     *
     * @return the post-state of every touched wallet
     * @throws com.flagship.crypto_ledger.exception.InsufficientFundsException if a DEBIT or LOCK leg overdraws
     * @throws com.flagship.crypto_ledger.exception.InvariantViolationException if an UNLOCK or SETTLE_LOCKED leg exceeds the locked balance
     */
    @Transactional
    public Map<WalletKey, Wallet> post(TransferRequest request) {
        validate(request);

        Map<WalletKey, Wallet> wallets = new LinkedHashMap<>(walletStore.lockForUpdate(request.walletKeys()));

        for (LedgerLeg leg : request.getLegs()) {
            Wallet after = apply(leg);
            wallets.put(after.key(), after);
        }

        log.debug("Posted transfer: description='{}', legs={}", request.getDescription(), request.getLegs().size());
        return wallets;
    }

    @Transactional(readOnly = true)
    public List<Wallet> getWallets(UUID accountId) {
        List<Wallet> wallets = walletStore.findWallets(accountId);
        if (wallets.isEmpty()) {
            throw ResourceNotFoundException.account(accountId);
        }
        return wallets;
    }

    @Transactional(readOnly = true)
    public Wallet getWallet(UUID accountId, String currency) {
        return walletStore.findWallet(accountId, settings.requireSupported(currency))
            .orElseThrow(() -> ResourceNotFoundException.account(accountId));
    }

    /**
     * Σ(balance + locked_balance) per currency across every account.
     */
    @Transactional(readOnly = true)
    public Map<String, BigDecimal> currencyTotals() {
        return walletStore.currencyTotals();
    }

    private Wallet apply(LedgerLeg leg) {
        return switch (leg.getType()) {
            case CREDIT -> walletStore.transfer(leg.getAccountId(), leg.getCurrency(), leg.getAmount());
            case DEBIT -> walletStore.transfer(leg.getAccountId(), leg.getCurrency(), leg.getAmount().negate());
            case LOCK -> walletStore.lock(leg.getAccountId(), leg.getCurrency(), leg.getAmount());
            case UNLOCK -> walletStore.unlock(leg.getAccountId(), leg.getCurrency(), leg.getAmount());
            case SETTLE_LOCKED -> walletStore.releaseLocked(leg.getAccountId(), leg.getCurrency(), leg.getAmount());
        };
    }

    private void validate(TransferRequest request) {
        if (request.getLegs() == null || request.getLegs().isEmpty()) {
            throw new InvalidOperationException("Transfer must have at least one leg");
        }
        for (LedgerLeg leg : request.getLegs()) {
            Amounts.requirePositive(leg.getAmount(), "Leg amount");
            if (!settings.getCurrencies().contains(leg.getCurrency())) {
                throw new InvalidOperationException("Unsupported currency: " + leg.getCurrency());
            }
        }
    }
}
