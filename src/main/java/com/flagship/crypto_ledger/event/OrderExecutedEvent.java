package com.flagship.crypto_ledger.event;

import com.flagship.crypto_ledger.trading.TradeTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A market order was filled. fee left circulation.
 */
@Value
public class OrderExecutedEvent implements TradingEvent {
    UUID eventId;
    UUID transactionId;
    UUID accountId;
    String pair;
    String side;
    BigDecimal amount;
    BigDecimal price;
    BigDecimal quoteAmount;
    BigDecimal fee;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderExecuted";

    public static OrderExecutedEvent of(TradeTransaction transaction) {
        return new OrderExecutedEvent(UUID.randomUUID(), transaction.getId(), transaction.getAccountId(),
            transaction.getPair().symbol(), transaction.getSide().name(), transaction.getAmount(),
            transaction.getPrice(), transaction.getQuoteAmount(), transaction.getFee(), transaction.getExecutedAt());
    }

    @Override
    public UUID getAggregateId() {
        return transactionId;
    }

    @Override
    public String getAggregateType() {
        return "Order";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
