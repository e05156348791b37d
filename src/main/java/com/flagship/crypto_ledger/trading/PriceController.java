package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.trading.dto.PricesResponse;
import com.flagship.crypto_ledger.trading.dto.UpdatePriceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/prices")
@RequiredArgsConstructor
@Slf4j
public class PriceController {

    private final ConfiguredPriceOracle priceOracle;
    private final TradingSettings settings;

    @GetMapping
    public PricesResponse getPrices() {
        return PricesResponse.builder()
            .baseCurrency(settings.getBaseCurrency())
            .prices(priceOracle.referencePrices())
            .build();
    }

    /**
     * Operator hook for moving the simulated market.
     */
    @PutMapping("/{currency}")
    public PricesResponse updatePrice(
            @PathVariable("currency") String currency,
            @Valid @RequestBody UpdatePriceRequest request) {

        String symbol = priceOracle.updatePrice(currency, request.getPrice());
        log.info("Reference price set: {}={}", symbol, request.getPrice().toPlainString());
        return getPrices();
    }
}
