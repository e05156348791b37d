package com.flagship.crypto_ledger.exception;

import com.flagship.crypto_ledger.offer.OfferStatus;

import java.util.UUID;

/**
 * A transition was attempted on an offer that already reached a terminal state.
 */
public class OfferNotActiveException extends LedgerException {

    private final UUID offerId;
    private final OfferStatus status;

    public OfferNotActiveException(UUID offerId, OfferStatus status) {
        super("OfferNotActive", String.format("Offer %s is %s, only ACTIVE offers can be accepted or cancelled",
            offerId, status));
        this.offerId = offerId;
        this.status = status;
    }

    public UUID getOfferId() {
        return offerId;
    }

    public OfferStatus getStatus() {
        return status;
    }
}
