package com.flagship.crypto_ledger.trading;

import com.flagship.crypto_ledger.exception.InvalidOperationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TradingPairTest {

    @Test
    @DisplayName("Parses slash and dash separators in any case")
    void testParse() {
        assertEquals(new TradingPair("BTC", "USDT"), TradingPair.parse("btc/usdt"));
        assertEquals(new TradingPair("ETH", "BTC"), TradingPair.parse(" ETH-btc "));
        assertEquals("SOL/USDT", TradingPair.parse("sol/USDT").symbol());
    }

    @Test
    @DisplayName("Malformed and degenerate pairs are rejected")
    void testParse_Invalid() {
        assertThrows(InvalidOperationException.class, () -> TradingPair.parse(null));
        assertThrows(InvalidOperationException.class, () -> TradingPair.parse("BTCUSDT"));
        assertThrows(InvalidOperationException.class, () -> TradingPair.parse("BTC/ETH/USDT"));
        assertThrows(InvalidOperationException.class, () -> TradingPair.parse("BTC/btc"));
        assertThrows(InvalidOperationException.class, () -> TradingPair.parse("/USDT"));
    }
}
