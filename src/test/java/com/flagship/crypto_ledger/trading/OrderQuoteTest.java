package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.exception.InvalidOperationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class OrderQuoteTest {

    private static final TradingPair BTC_USDT = new TradingPair("BTC", "USDT");
    private static final BigDecimal FEE_RATE = new BigDecimal("0.001");

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Buy pays gross plus fee in the quote currency")
    void testBuy() {
        OrderQuote quote = OrderQuote.of(BTC_USDT, OrderSide.BUY, new BigDecimal("0.1"), new BigDecimal("50000"), FEE_RATE);

        assertAmount("5000", quote.getGrossValue());
        assertAmount("5", quote.getFee());
        assertAmount("5005", quote.getQuoteAmount());
        assertEquals("USDT", quote.debitCurrency());
        assertAmount("5005", quote.debitAmount());
        assertEquals("BTC", quote.creditCurrency());
        assertAmount("0.1", quote.creditAmount());
    }

    @Test
    @DisplayName("Sell receives gross minus fee in the quote currency")
    void testSell() {
        OrderQuote quote = OrderQuote.of(BTC_USDT, OrderSide.SELL, new BigDecimal("0.1"), new BigDecimal("50000"), FEE_RATE);

        assertAmount("4995", quote.getQuoteAmount());
        assertAmount("5", quote.getFee());
        assertEquals("BTC", quote.debitCurrency());
        assertAmount("0.1", quote.debitAmount());
        assertEquals("USDT", quote.creditCurrency());
        assertAmount("4995", quote.creditAmount());
    }

    @Test
    @DisplayName("Sub-unit rounding favours the ledger: buys round up, sells round down")
    void testRounding() {
        // gross 0.00000333 * 3 = 0.00000999, raw fee 0.00000000999
        BigDecimal amount = new BigDecimal("0.00000333");
        BigDecimal price = new BigDecimal("3");

        OrderQuote buy = OrderQuote.of(BTC_USDT, OrderSide.BUY, amount, price, FEE_RATE);
        OrderQuote sell = OrderQuote.of(BTC_USDT, OrderSide.SELL, amount, price, FEE_RATE);

        assertAmount("0.00001000", buy.getQuoteAmount());
        assertAmount("0.00000998", sell.getQuoteAmount());
        assertEquals(8, buy.getQuoteAmount().scale());
        assertEquals(8, sell.getQuoteAmount().scale());
    }

    @Test
    @DisplayName("Orders worth nothing after rounding are rejected")
    void testTooSmall() {
        assertThrows(InvalidOperationException.class, () -> OrderQuote.of(
            BTC_USDT, OrderSide.SELL, new BigDecimal("0.00000001"), new BigDecimal("0.5"), FEE_RATE));
    }

    @Test
    @DisplayName("Non-positive price is rejected")
    void testBadPrice() {
        assertThrows(InvalidOperationException.class, () -> OrderQuote.of(
            BTC_USDT, OrderSide.BUY, BigDecimal.ONE, BigDecimal.ZERO, FEE_RATE));
    }

    @Test
    @DisplayName("Recorded fee closes the gap between gross value and quote amount")
    void testFeeAddsUp() {
        // gross 0.0000000012345678 rounds to zero, the whole unit charged is fee
        OrderQuote buy = OrderQuote.of(BTC_USDT, OrderSide.BUY,
            new BigDecimal("0.00000001"), new BigDecimal("0.12345678"), FEE_RATE);
        assertAmount("0", buy.getGrossValue());
        assertAmount("0.00000001", buy.getQuoteAmount());
        assertAmount("0.00000001", buy.getFee());
        assertAmount(buy.getQuoteAmount().toPlainString(), buy.getGrossValue().add(buy.getFee()));

        OrderQuote sell = OrderQuote.of(BTC_USDT, OrderSide.SELL,
            new BigDecimal("0.00000333"), new BigDecimal("3"), FEE_RATE);
        assertAmount("0.00000999", sell.getGrossValue());
        assertAmount("0.00000001", sell.getFee());
        assertAmount(sell.getQuoteAmount().toPlainString(), sell.getGrossValue().subtract(sell.getFee()));
    }

    @Test
    @DisplayName("Prices and order values beyond the storable range are rejected")
    void testUnstorable() {
        assertThrows(InvalidOperationException.class, () -> OrderQuote.of(
            BTC_USDT, OrderSide.SELL, BigDecimal.ONE, new BigDecimal("1E+21"), FEE_RATE));
        // each factor fits, the product does not
        assertThrows(InvalidOperationException.class, () -> OrderQuote.of(
            BTC_USDT, OrderSide.BUY, new BigDecimal("10000000000"), new BigDecimal("10000000000"), FEE_RATE));

        OrderQuote large = OrderQuote.of(
            BTC_USDT, OrderSide.SELL, new BigDecimal("1000000000"), new BigDecimal("1000000000"), FEE_RATE);
        assertAmount("999000000000000000", large.getQuoteAmount());
    }
}
