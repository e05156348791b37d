package com.flagship.crypto_ledger.offer;

import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.exception.OfferNotActiveException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TradeOfferTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant LATER = CREATED.plusSeconds(60);

    private final UUID creator = UUID.randomUUID();
    private final UUID other = UUID.randomUUID();

    private TradeOffer activeOffer() {
        return TradeOffer.create(UUID.randomUUID(), creator, "ETH", BigDecimal.ONE, "USDT", new BigDecimal("2000"), CREATED);
    }

    @Test
    @DisplayName("New offer is active with no acceptor")
    void testCreate() {
        TradeOffer offer = activeOffer();

        assertEquals(OfferStatus.ACTIVE, offer.getStatus());
        assertNull(offer.getAcceptedBy());
        assertEquals(CREATED, offer.getCreatedAt());
        assertEquals(CREATED, offer.getUpdatedAt());
        assertTrue(offer.canTransitionTo(OfferStatus.COMPLETED));
        assertTrue(offer.canTransitionTo(OfferStatus.CANCELLED));
        assertFalse(offer.canTransitionTo(OfferStatus.ACTIVE));
    }

    @Test
    @DisplayName("Offering and requesting the same currency is rejected")
    void testCreate_SameCurrency() {
        assertThrows(InvalidOperationException.class, () -> TradeOffer.create(
            UUID.randomUUID(), creator, "ETH", BigDecimal.ONE, "ETH", BigDecimal.TEN, CREATED));
    }

    @Test
    @DisplayName("Complete records the acceptor and returns a new instance")
    void testComplete() {
        TradeOffer offer = activeOffer();
        TradeOffer completed = offer.complete(other, LATER);

        assertEquals(OfferStatus.COMPLETED, completed.getStatus());
        assertEquals(other, completed.getAcceptedBy());
        assertEquals(LATER, completed.getUpdatedAt());
        assertEquals(OfferStatus.ACTIVE, offer.getStatus());
        assertFalse(completed.canTransitionTo(OfferStatus.CANCELLED));
    }

    @Test
    @DisplayName("Self-acceptance is rejected before the status is considered")
    void testComplete_SelfTradeFirst() {
        TradeOffer cancelled = activeOffer().cancel(creator, LATER);

        assertThrows(InvalidOperationException.class, () -> activeOffer().complete(creator, LATER));
        assertThrows(InvalidOperationException.class, () -> cancelled.complete(creator, LATER));
    }

    @Test
    @DisplayName("Terminal offers reject every further transition")
    void testTerminalStates() {
        TradeOffer completed = activeOffer().complete(other, LATER);
        TradeOffer cancelled = activeOffer().cancel(creator, LATER);

        OfferNotActiveException e = assertThrows(OfferNotActiveException.class,
            () -> completed.complete(UUID.randomUUID(), LATER));
        assertEquals(OfferStatus.COMPLETED, e.getStatus());
        assertThrows(OfferNotActiveException.class, () -> completed.cancel(creator, LATER));
        assertThrows(OfferNotActiveException.class, () -> cancelled.complete(other, LATER));
        assertThrows(OfferNotActiveException.class, () -> cancelled.cancel(creator, LATER));

        assertFalse(completed.canTransitionTo(OfferStatus.CANCELLED));
        assertFalse(cancelled.canTransitionTo(OfferStatus.COMPLETED));
    }

    @Test
    @DisplayName("Only the creator may cancel")
    void testCancel_NotCreator() {
        assertThrows(InvalidOperationException.class, () -> activeOffer().cancel(other, LATER));
    }
}
