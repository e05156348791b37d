package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.event.OrderExecutedEvent;
import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.exception.LedgerException;
import com.flagship.crypto_ledger.exception.PriceUnavailableException;
import com.flagship.crypto_ledger.ledger.Amounts;
import com.flagship.crypto_ledger.ledger.LedgerLeg;
import com.flagship.crypto_ledger.ledger.LedgerService;
import com.flagship.crypto_ledger.ledger.TransferRequest;
import com.flagship.crypto_ledger.observability.CorrelationContext;
import com.flagship.crypto_ledger.observability.TradingMetrics;
import com.flagship.crypto_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Executes market orders against a price supplied by the caller.
 *
 * One database transaction per order:
 * 1. debit leg (quote on buy, base on sell) and credit leg are posted together
 * 2. the transaction record is appended after both legs succeed
 * 3. OrderExecuted is written to the outbox
 *
 * A failure at any step rolls back all three. The fee is removed from
 * circulation; it is recorded on the transaction row and in trading.fees.burned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketOrderExecutor {

    private static final int MAX_HISTORY = 500;

    private final LedgerService ledgerService;
    private final TradeTransactionRepository transactionRepository;
    private final OutboxService outboxService;
    private final TradingSettings settings;
    private final TradingMetrics metrics;
    private final Clock clock;

    /**
     * @throws PriceUnavailableException if the request carries no price; nothing is touched
     * @throws com.flagship.crypto_ledger.exception.InsufficientFundsException if the debit leg overdraws
     * @throws InvalidOperationException for unsupported currencies, non-positive or over-precise amounts
     */
    @Transactional
    public TradeTransaction execute(MarketOrderRequest request) {
        TradingPair pair = request.getPair();
        String side = request.getSide() != null ? request.getSide().name() : "unknown";
        CorrelationContext.putAccount(request.getAccountId());

        try {
            TradeTransaction transaction = metrics.time("order", () -> doExecute(request));
            metrics.recordOrder(pair.symbol(), side, "success");
            metrics.recordFeeBurned(transaction.getFeeCurrency(), transaction.getFee());
            return transaction;
        } catch (LedgerException e) {
            metrics.recordOrder(pairTag(pair), side, e.getErrorCode());
            log.info("Order rejected: pair={}, side={}, amount={}, reason={}",
                pair, side, request.getAmount(), e.getMessage());
            throw e;
        }
    }

    @Transactional(readOnly = true)
    public List<TradeTransaction> getTransactions(UUID accountId, TradingPair pair, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_HISTORY)));
        List<TradeTransactionEntity> rows = pair == null
            ? transactionRepository.findByAccountIdOrderByExecutedAtDesc(accountId, page)
            : transactionRepository.findByAccountIdAndPairOrderByExecutedAtDesc(accountId, pair.symbol(), page);
        return rows.stream().map(TradeTransactionEntity::toDomain).toList();
    }

    /**
     * Only configured pairs become tag values; anything a client invents is "invalid".
     */
    private String pairTag(TradingPair pair) {
        if (pair == null || !settings.isSupported(pair.getBase()) || !settings.isSupported(pair.getQuote())) {
            return "invalid";
        }
        return pair.symbol();
    }

    private TradeTransaction doExecute(MarketOrderRequest request) {
        if (request.getAccountId() == null || request.getPair() == null || request.getSide() == null) {
            throw new InvalidOperationException("Order needs an account, a pair and a side");
        }
        TradingPair pair = new TradingPair(
            settings.requireSupported(request.getPair().getBase()),
            settings.requireSupported(request.getPair().getQuote()));
        BigDecimal amount = Amounts.requirePositive(request.getAmount(), "Order amount");

        if (request.getPrice() == null) {
            throw new PriceUnavailableException(pair.symbol());
        }

        OrderQuote quote = OrderQuote.of(pair, request.getSide(), amount, request.getPrice(), settings.getFeeRate());
        UUID accountId = request.getAccountId();

        ledgerService.post(TransferRequest.of(
            String.format("Market %s %s %s @ %s", quote.getSide(), amount.toPlainString(), pair,
                quote.getPrice().toPlainString()),
            LedgerLeg.debit(accountId, quote.debitCurrency(), quote.debitAmount()),
            LedgerLeg.credit(accountId, quote.creditCurrency(), quote.creditAmount())
        ));

        Instant now = clock.instant();
        TradeTransaction transaction = TradeTransaction.from(UUID.randomUUID(), accountId, quote, now);
        transactionRepository.save(TradeTransactionEntity.fromDomain(transaction));
        outboxService.saveEvent(OrderExecutedEvent.of(transaction));

        log.info("Order executed: transactionId={}, pair={}, side={}, amount={}, price={}, quoteAmount={}, fee={}",
            transaction.getId(), pair, quote.getSide(), amount.toPlainString(),
            quote.getPrice().toPlainString(), quote.getQuoteAmount().toPlainString(), quote.getFee().toPlainString());

        return transaction;
    }
}
