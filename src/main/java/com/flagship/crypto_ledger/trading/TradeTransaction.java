package com.flagship.crypto_ledger.trading;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An executed market order. Immutable once written.
 */
@Value
public class TradeTransaction {
    UUID id;
    UUID accountId;
    TradingPair pair;
    OrderSide side;
    BigDecimal amount;
    BigDecimal price;
    BigDecimal quoteAmount;    // debited on buy, credited on sell; includes the fee
    BigDecimal fee;
    Instant executedAt;

    public static TradeTransaction from(UUID id, UUID accountId, OrderQuote quote, Instant executedAt) {
        return new TradeTransaction(id, accountId, quote.getPair(), quote.getSide(), quote.getAmount(),
            quote.getPrice(), quote.getQuoteAmount(), quote.getFee(), executedAt);
    }

    /**
     * Fees are always charged in the quote currency.
     */
    public String getFeeCurrency() {
        return pair.getQuote();
    }
}
