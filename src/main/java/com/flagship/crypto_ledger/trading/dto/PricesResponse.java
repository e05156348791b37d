package com.flagship.crypto_ledger.trading.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class PricesResponse {

    @JsonProperty("base_currency")
    String baseCurrency;

    @JsonProperty("prices")
    Map<String, BigDecimal> prices;
}
