package com.flagship.crypto_ledger.offer;

import lombok.Value;

/**
 * An offer with its creator's display name, for the public offer board.
 */
@Value
public class OfferListing {
    TradeOffer offer;
    String creatorName;
}
