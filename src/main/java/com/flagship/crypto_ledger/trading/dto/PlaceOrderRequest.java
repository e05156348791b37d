package com.flagship.crypto_ledger.trading.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Market order. When price is omitted the current oracle price is used.
 */
@Value
@Builder
@Jacksonized
public class PlaceOrderRequest {

    @NotBlank(message = "Pair is required")
    @JsonProperty("pair")
    String pair;

    @NotBlank(message = "Side is required")
    @JsonProperty("side")
    String side;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @DecimalMin(value = "0", inclusive = false, message = "Price must be greater than 0")
    @JsonProperty("price")
    BigDecimal price;
}
