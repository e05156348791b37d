package com.flagship.crypto_ledger.ledger;

import com.flagship.crypto_ledger.exception.InsufficientFundsException;
import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.exception.InvariantViolationException;
import com.flagship.crypto_ledger.exception.ResourceNotFoundException;
import com.flagship.crypto_ledger.exception.StorageFailures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Wallet balances, one row per (account, currency).
 *
 * Every mutation is a single conditional UPDATE: the non-negativity check and
 * the write happen in the same statement, so two concurrent debits can never
 * both pass a stale balance check. Zero rows updated means the precondition
 * failed, and the wallet is re-read only to build the error.
 *
 * Balances are stored, not derived. CHECK constraints on the table reject a
 * negative balance from any writer, this class included.
 */
@Repository
@Slf4j
public class WalletStore {

    private static final String COLUMNS = "account_id, currency, balance, locked_balance, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public WalletStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Creates one zero wallet per currency, then seeds one of them.
     * Runs inside the caller's account-creation transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void openWallets(UUID accountId, Collection<String> currencies, String seedCurrency, BigDecimal seedAmount) {
        Timestamp now = now();
        List<Object[]> rows = new ArrayList<>();
        for (String currency : currencies) {
            BigDecimal opening = currency.equals(seedCurrency) ? seedAmount : BigDecimal.ZERO;
            rows.add(new Object[]{accountId, currency, opening, now});
        }
        StorageFailures.translate("openWallets", () -> jdbcTemplate.batchUpdate(
            "INSERT INTO wallets (account_id, currency, balance, locked_balance, updated_at) " +
            "VALUES (?, ?, ?, 0, ?)",
            rows
        ));
        log.debug("Opened {} wallets for account {}, seeded {} {}", currencies.size(), accountId, seedAmount, seedCurrency);
    }

    /**
     * balance += delta, provided the result is non-negative.
     */
    @Transactional
    public Wallet transfer(UUID accountId, String currency, BigDecimal delta) {
        if (delta.signum() == 0) {
            throw new InvalidOperationException("Transfer amount must be non-zero");
        }
        Optional<Wallet> updated = updateReturning(
            "UPDATE wallets SET balance = balance + ?, updated_at = ? " +
            "WHERE account_id = ? AND currency = ? AND balance + ? >= 0",
            delta, now(), accountId, currency, delta);
        return updated.orElseThrow(() -> insufficient(accountId, currency, delta.negate()));
    }

    /**
     * Moves amount from balance to locked_balance.
     */
    @Transactional
    public Wallet lock(UUID accountId, String currency, BigDecimal amount) {
        requirePositive(amount);
        Optional<Wallet> updated = updateReturning(
            "UPDATE wallets SET balance = balance - ?, locked_balance = locked_balance + ?, updated_at = ? " +
            "WHERE account_id = ? AND currency = ? AND balance >= ?",
            amount, amount, now(), accountId, currency, amount);
        return updated.orElseThrow(() -> insufficient(accountId, currency, amount));
    }

    /**
     * Moves amount from locked_balance back to balance.
     * Less locked than requested means escrow bookkeeping is broken.
     */
    @Transactional
    public Wallet unlock(UUID accountId, String currency, BigDecimal amount) {
        requirePositive(amount);
        Optional<Wallet> updated = updateReturning(
            "UPDATE wallets SET balance = balance + ?, locked_balance = locked_balance - ?, updated_at = ? " +
            "WHERE account_id = ? AND currency = ? AND locked_balance >= ?",
            amount, amount, now(), accountId, currency, amount);
        return updated.orElseThrow(() -> lockedShortfall("unlock", accountId, currency, amount));
    }

    /**
     * Removes amount from locked_balance; the escrowed funds leave the account.
     */
    @Transactional
    public Wallet releaseLocked(UUID accountId, String currency, BigDecimal amount) {
        requirePositive(amount);
        Optional<Wallet> updated = updateReturning(
            "UPDATE wallets SET locked_balance = locked_balance - ?, updated_at = ? " +
            "WHERE account_id = ? AND currency = ? AND locked_balance >= ?",
            amount, now(), accountId, currency, amount);
        return updated.orElseThrow(() -> lockedShortfall("releaseLocked", accountId, currency, amount));
    }

    /**
     * Row-locks the given wallets in key order for the rest of the surrounding transaction.
     * Every multi-wallet operation goes through here so lock acquisition order is global.
     *
     * @throws ResourceNotFoundException if any wallet does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<WalletKey, Wallet> lockForUpdate(Collection<WalletKey> keys) {
        List<WalletKey> ordered = keys.stream().distinct().sorted().toList();
        Map<WalletKey, Wallet> locked = new LinkedHashMap<>();
        for (WalletKey key : ordered) {
            List<Wallet> rows = StorageFailures.translate("lockForUpdate", () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM wallets WHERE account_id = ? AND currency = ? FOR UPDATE",
                walletRowMapper(),
                key.getAccountId(), key.getCurrency()
            ));
            if (rows.isEmpty()) {
                throw ResourceNotFoundException.account(key.getAccountId());
            }
            locked.put(key, rows.get(0));
        }
        return locked;
    }

    @Transactional(readOnly = true)
    public Optional<Wallet> findWallet(UUID accountId, String currency) {
        List<Wallet> rows = StorageFailures.translate("findWallet", () -> jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM wallets WHERE account_id = ? AND currency = ?",
            walletRowMapper(),
            accountId, currency
        ));
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<Wallet> findWallets(UUID accountId) {
        return StorageFailures.translate("findWallets", () -> jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM wallets WHERE account_id = ? ORDER BY currency",
            walletRowMapper(),
            accountId
        ));
    }

    @Transactional(readOnly = true)
    public List<Wallet> findAll() {
        return StorageFailures.translate("findAll", () -> jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM wallets ORDER BY account_id, currency",
            walletRowMapper()
        ));
    }

    @Transactional(readOnly = true)
    public List<Wallet> findByCurrency(String currency) {
        return StorageFailures.translate("findByCurrency", () -> jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM wallets WHERE currency = ? ORDER BY account_id",
            walletRowMapper(),
            currency
        ));
    }

    /**
     * Sum of locked_balance per (account, currency) where it is non-zero.
     */
    @Transactional(readOnly = true)
    public Map<WalletKey, BigDecimal> lockedBalances() {
        Map<WalletKey, BigDecimal> locked = new LinkedHashMap<>();
        StorageFailures.translate("lockedBalances", () -> {
            jdbcTemplate.query(
                "SELECT account_id, currency, locked_balance FROM wallets WHERE locked_balance <> 0",
                rs -> {
                    locked.put(new WalletKey(rs.getObject("account_id", UUID.class), rs.getString("currency")),
                        rs.getBigDecimal("locked_balance"));
                }
            );
            return null;
        });
        return locked;
    }

    /**
     * Total owned (balance + locked_balance) per currency across all accounts.
     */
    @Transactional(readOnly = true)
    public Map<String, BigDecimal> currencyTotals() {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        StorageFailures.translate("currencyTotals", () -> {
            jdbcTemplate.query(
                "SELECT currency, SUM(balance + locked_balance) AS total FROM wallets GROUP BY currency ORDER BY currency",
                rs -> {
                    totals.put(rs.getString("currency"), rs.getBigDecimal("total"));
                }
            );
            return null;
        });
        return totals;
    }

    private Optional<Wallet> updateReturning(String sql, Object... args) {
        List<Wallet> rows = StorageFailures.translate("wallet update", () ->
            jdbcTemplate.query(sql + " RETURNING " + COLUMNS, walletRowMapper(), args));
        return rows.stream().findFirst();
    }

    private InsufficientFundsException insufficient(UUID accountId, String currency, BigDecimal required) {
        Wallet wallet = findWallet(accountId, currency)
            .orElseThrow(() -> ResourceNotFoundException.account(accountId));
        return new InsufficientFundsException(accountId, currency, required, wallet.getBalance());
    }

    private RuntimeException lockedShortfall(String operation, UUID accountId, String currency, BigDecimal amount) {
        Optional<Wallet> wallet = findWallet(accountId, currency);
        if (wallet.isEmpty()) {
            return ResourceNotFoundException.account(accountId);
        }
        String message = String.format("%s of %s %s on account %s exceeds locked balance %s",
            operation, amount.toPlainString(), currency, accountId, wallet.get().getLockedBalance().toPlainString());
        log.error("Escrow invariant violated: {}", message);
        return new InvariantViolationException(message);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidOperationException("Amount must be positive: " + amount);
        }
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    private static RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            rs.getObject("account_id", UUID.class),
            rs.getString("currency"),
            rs.getBigDecimal("balance"),
            rs.getBigDecimal("locked_balance"),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
