package com.flagship.crypto_ledger.portfolio;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class PortfolioValue {
    UUID accountId;
    String valuationCurrency;
    BigDecimal totalValue;
    List<HoldingValue> holdings;
}
