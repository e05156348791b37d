package com.flagship.crypto_ledger.bonus;

import com.flagship.crypto_ledger.account.Account;
import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.event.BonusClaimedEvent;
import com.flagship.crypto_ledger.exception.LedgerException;
import com.flagship.crypto_ledger.exception.StorageFailures;
import com.flagship.crypto_ledger.exception.TooEarlyException;
import com.flagship.crypto_ledger.ledger.LedgerLeg;
import com.flagship.crypto_ledger.ledger.LedgerService;
import com.flagship.crypto_ledger.ledger.TransferRequest;
import com.flagship.crypto_ledger.observability.CorrelationContext;
import com.flagship.crypto_ledger.observability.TradingMetrics;
import com.flagship.crypto_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Daily bonus, once per cooldown window per account.
 *
 * The only gate is one conditional UPDATE of accounts.last_bonus_claim.
 * Concurrent claims queue on the account row; after the winner commits the
 * others re-evaluate the WHERE clause against the new timestamp and update
 * nothing. The credit, the audit row and the event share the winner's transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BonusService {

    private final JdbcTemplate jdbcTemplate;
    private final AccountRegistry accountRegistry;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final TradingSettings settings;
    private final TradingMetrics metrics;
    private final Clock clock;

    /**
     * @throws TooEarlyException if the last claim is less than one cooldown old; nothing changes
     * @throws com.flagship.crypto_ledger.exception.ResourceNotFoundException if the account does not exist
     */
    @Transactional
    public BonusClaim claim(UUID accountId) {
        CorrelationContext.putAccount(accountId);
        try {
            BonusClaim claim = metrics.time("bonus", () -> doClaim(accountId));
            metrics.recordBonusClaim("success");
            return claim;
        } catch (LedgerException e) {
            metrics.recordBonusClaim(e.getErrorCode());
            throw e;
        }
    }

    @Transactional(readOnly = true)
    public BonusStatus getStatus(UUID accountId) {
        Account account = accountRegistry.getAccount(accountId);
        Instant now = now();
        Instant last = account.getLastBonusClaim();
        if (last == null) {
            return new BonusStatus(true, null, now, Duration.ZERO);
        }
        Instant next = last.plus(settings.getBonusCooldown());
        Duration remaining = remainingUntil(now, next);
        return new BonusStatus(remaining.isZero(), last, next, remaining);
    }

    private BonusClaim doClaim(UUID accountId) {
        Instant now = now();
        Duration cooldown = settings.getBonusCooldown();

        int gated = StorageFailures.translate("claimBonus", () -> jdbcTemplate.update(
            "UPDATE accounts SET last_bonus_claim = ? " +
            "WHERE id = ? AND (last_bonus_claim IS NULL OR last_bonus_claim <= ?)",
            Timestamp.from(now), accountId, Timestamp.from(now.minus(cooldown))
        ));

        if (gated == 0) {
            throw tooEarly(accountId, now);
        }

        String currency = settings.getBaseCurrency();
        ledgerService.post(TransferRequest.of("Daily bonus",
            LedgerLeg.credit(accountId, currency, settings.getBonusAmount())));

        UUID claimId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO bonus_claims (id, account_id, claim_date, currency, amount, claimed_at) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            claimId, accountId, Date.valueOf(LocalDate.ofInstant(now, ZoneOffset.UTC)),
            currency, settings.getBonusAmount(), Timestamp.from(now)
        );

        Instant next = now.plus(cooldown);
        outboxService.saveEvent(new BonusClaimedEvent(UUID.randomUUID(), claimId, accountId,
            currency, settings.getBonusAmount(), next, now));

        log.info("Bonus claimed: amount={} {}, nextEligibleAt={}", settings.getBonusAmount(), currency, next);
        return new BonusClaim(claimId, accountId, currency, settings.getBonusAmount(), now, next);
    }

    private TooEarlyException tooEarly(UUID accountId, Instant now) {
        Account account = accountRegistry.getAccount(accountId);
        Instant last = account.getLastBonusClaim() != null ? account.getLastBonusClaim() : now;
        Instant next = last.plus(settings.getBonusCooldown());
        log.info("Bonus claim too early: lastClaimAt={}, nextEligibleAt={}", last, next);
        return new TooEarlyException(remainingUntil(now, next), next);
    }

    private static Duration remainingUntil(Instant now, Instant next) {
        Duration remaining = Duration.between(now, next);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * TIMESTAMPTZ keeps microseconds; truncating keeps the stored and compared instants identical.
     */
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
