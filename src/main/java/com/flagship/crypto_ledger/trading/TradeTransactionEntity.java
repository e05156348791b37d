package com.flagship.crypto_ledger.trading;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Row of the append-only transactions table. Every column is updatable = false;
 * the table's trigger rejects UPDATE and DELETE as well.
 */
@Entity
@Table(name = "transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TradeTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, updatable = false, length = 33)
    private String pair;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 4)
    private OrderSide side;

    @Column(nullable = false, updatable = false, precision = 28, scale = 8)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, precision = 28, scale = 8)
    private BigDecimal price;

    @Column(name = "quote_amount", nullable = false, updatable = false, precision = 28, scale = 8)
    private BigDecimal quoteAmount;

    @Column(nullable = false, updatable = false, precision = 28, scale = 8)
    private BigDecimal fee;

    @Column(name = "executed_at", nullable = false, updatable = false)
    private Instant executedAt;

    public static TradeTransactionEntity fromDomain(TradeTransaction transaction) {
        TradeTransactionEntity entity = new TradeTransactionEntity();
        entity.id = transaction.getId();
        entity.accountId = transaction.getAccountId();
        entity.pair = transaction.getPair().symbol();
        entity.side = transaction.getSide();
        entity.amount = transaction.getAmount();
        entity.price = transaction.getPrice();
        entity.quoteAmount = transaction.getQuoteAmount();
        entity.fee = transaction.getFee();
        entity.executedAt = transaction.getExecutedAt();
        return entity;
    }

    public TradeTransaction toDomain() {
        return new TradeTransaction(id, accountId, TradingPair.parse(pair), side, amount, price,
            quoteAmount, fee, executedAt);
    }
}
