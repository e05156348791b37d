package com.flagship.crypto_ledger.offer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class CreateOfferRequest {

    @NotBlank(message = "Offering currency is required")
    @JsonProperty("offering_currency")
    String offeringCurrency;

    @NotNull(message = "Offering amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Offering amount must be greater than 0")
    @JsonProperty("offering_amount")
    BigDecimal offeringAmount;

    @NotBlank(message = "Requesting currency is required")
    @JsonProperty("requesting_currency")
    String requestingCurrency;

    @NotNull(message = "Requesting amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Requesting amount must be greater than 0")
    @JsonProperty("requesting_amount")
    BigDecimal requestingAmount;
}
