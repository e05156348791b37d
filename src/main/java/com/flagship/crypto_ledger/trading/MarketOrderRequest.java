package com.flagship.crypto_ledger.trading;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A market order with its execution price already resolved.
 * A null price means the oracle had none for the pair.
 */
@Value
@Builder
public class MarketOrderRequest {
    UUID accountId;
    TradingPair pair;
    OrderSide side;
    BigDecimal amount;
    BigDecimal price;
}
