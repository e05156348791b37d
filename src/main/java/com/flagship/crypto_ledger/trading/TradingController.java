package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.trading.dto.PlaceOrderRequest;
import com.flagship.crypto_ledger.trading.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Market orders against the oracle price.
 */
@RestController
@RequestMapping("/api/accounts/{accountId}")
@RequiredArgsConstructor
@Slf4j
public class TradingController {

    private final MarketOrderExecutor orderExecutor;
    private final PriceOracle priceOracle;
    private final AccountRegistry accountRegistry;

    /**
     * The price is resolved here, before the ledger transaction opens. A missing
     * oracle price reaches the executor as null and is rejected there.
     */
    @PostMapping("/orders")
    public ResponseEntity<TransactionResponse> placeOrder(
            @PathVariable("accountId") UUID accountId,
            @Valid @RequestBody PlaceOrderRequest request) {

        TradingPair pair = TradingPair.parse(request.getPair());
        OrderSide side = OrderSide.parse(request.getSide());
        BigDecimal price = request.getPrice() != null
            ? request.getPrice()
            : priceOracle.price(pair).orElse(null);

        log.info("Market order received: pair={}, side={}, amount={}, price={}",
            pair, side, request.getAmount(), price);

        TradeTransaction tx = orderExecutor.execute(MarketOrderRequest.builder()
            .accountId(accountId)
            .pair(pair)
            .side(side)
            .amount(request.getAmount())
            .price(price)
            .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(tx));
    }

    @GetMapping("/transactions")
    public List<TransactionResponse> getTransactions(
            @PathVariable("accountId") UUID accountId,
            @RequestParam(value = "pair", required = false) String pair,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {

        accountRegistry.requireExists(accountId);
        TradingPair filter = pair == null || pair.isBlank() ? null : TradingPair.parse(pair);
        return orderExecutor.getTransactions(accountId, filter, limit).stream()
            .map(TransactionResponse::from)
            .toList();
    }
}
