package com.flagship.crypto_ledger.account;

import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.event.AccountOpenedEvent;
import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.exception.InvariantViolationException;
import com.flagship.crypto_ledger.exception.ResourceNotFoundException;
import com.flagship.crypto_ledger.exception.StorageFailures;
import com.flagship.crypto_ledger.ledger.WalletStore;
import com.flagship.crypto_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps external identities to accounts.
 *
 * Account creation relies on the unique constraint on external_id, not on a
 * lookup: INSERT ... ON CONFLICT DO NOTHING makes a concurrent duplicate
 * wait for the winner's commit and then insert nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountRegistry {

    private static final int MAX_NAME_LENGTH = 255;
    private static final String COLUMNS = "id, external_id, display_name, last_bonus_claim, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;
    private final WalletStore walletStore;
    private final OutboxService outboxService;
    private final TradingSettings settings;
    private final Clock clock;

    @Transactional
    public AccountResolution resolveOrCreate(IdentityProvider identityProvider) {
        ExternalIdentity identity = identityProvider.authenticate();
        return resolveOrCreate(identity.getExternalId(), identity.getDisplayName());
    }

    /**
     * Finds the account for an external identity, creating it with one wallet
     * per supported currency (the base currency seeded) if it does not exist.
     */
    @Transactional
    public AccountResolution resolveOrCreate(String externalId, String displayName) {
        String id = requireText(externalId, "External id");
        String name = displayName == null || displayName.isBlank() ? id : displayName.trim();
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH);
        }

        UUID accountId = UUID.randomUUID();
        Instant now = clock.instant();
        String finalName = name;

        int inserted = StorageFailures.translate("resolveOrCreate", () -> jdbcTemplate.update(
            "INSERT INTO accounts (id, external_id, display_name, created_at) VALUES (?, ?, ?, ?) " +
            "ON CONFLICT (external_id) DO NOTHING",
            accountId, id, finalName, Timestamp.from(now)
        ));

        if (inserted == 1) {
            walletStore.openWallets(accountId, settings.getCurrencies(),
                settings.getBaseCurrency(), settings.getInitialBalance());

            Account account = new Account(accountId, id, finalName, null, now);
            outboxService.saveEvent(AccountOpenedEvent.of(account, settings.getBaseCurrency(),
                settings.getInitialBalance(), now));

            log.info("Account opened: accountId={}, externalId={}, seed={} {}",
                accountId, id, settings.getInitialBalance(), settings.getBaseCurrency());
            return new AccountResolution(account, true);
        }

        Account existing = findByExternalId(id).orElseThrow(() -> new InvariantViolationException(
            "Account insert for " + id + " conflicted but no account exists"));
        log.debug("Resolved existing account: accountId={}, externalId={}", existing.getId(), id);
        return new AccountResolution(existing, false);
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(UUID accountId) {
        return StorageFailures.translate("findAccount", () -> jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE id = ?",
            accountRowMapper(),
            accountId
        )).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<Account> findByExternalId(String externalId) {
        return StorageFailures.translate("findAccountByExternalId", () -> jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE external_id = ?",
            accountRowMapper(),
            externalId
        )).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID accountId) {
        return findById(accountId).orElseThrow(() -> ResourceNotFoundException.account(accountId));
    }

    /**
     * @throws ResourceNotFoundException if the account does not exist
     */
    @Transactional(readOnly = true)
    public void requireExists(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE id = ?", Integer.class, accountId);
        if (count == null || count == 0) {
            throw ResourceNotFoundException.account(accountId);
        }
    }

    @Transactional(readOnly = true)
    public Map<UUID, String> displayNames(Collection<UUID> accountIds) {
        Map<UUID, String> names = new HashMap<>();
        if (accountIds.isEmpty()) {
            return names;
        }
        namedParameterJdbcTemplate.query(
            "SELECT id, display_name FROM accounts WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", accountIds),
            rs -> {
                names.put(rs.getObject("id", UUID.class), rs.getString("display_name"));
            }
        );
        return names;
    }

    @Transactional(readOnly = true)
    public List<Account> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM accounts ORDER BY id", accountRowMapper());
    }

    @Transactional(readOnly = true)
    public long countAccounts() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM accounts", Long.class);
        return count != null ? count : 0L;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidOperationException(field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new InvalidOperationException(field + " exceeds " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    static RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            Timestamp lastBonus = rs.getTimestamp("last_bonus_claim");
            return new Account(
                rs.getObject("id", UUID.class),
                rs.getString("external_id"),
                rs.getString("display_name"),
                lastBonus != null ? lastBonus.toInstant() : null,
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }
}
