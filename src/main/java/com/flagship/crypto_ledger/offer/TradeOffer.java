package com.flagship.crypto_ledger.offer;

import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.exception.OfferNotActiveException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A peer trade offer: the creator escrows offeringAmount of offeringCurrency
 * and wants requestingAmount of requestingCurrency in return.
 *
 * ACTIVE -> COMPLETED (accepted by another account)
 * ACTIVE -> CANCELLED (withdrawn by the creator)
 *
 * Both targets are terminal. Transitions return a new instance.
 */
@Value
public class TradeOffer {
    UUID id;
    UUID creatorId;
    String offeringCurrency;
    BigDecimal offeringAmount;
    String requestingCurrency;
    BigDecimal requestingAmount;
    OfferStatus status;
    UUID acceptedBy;
    Instant createdAt;
    Instant updatedAt;

    public static TradeOffer create(UUID id, UUID creatorId,
                                    String offeringCurrency, BigDecimal offeringAmount,
                                    String requestingCurrency, BigDecimal requestingAmount,
                                    Instant now) {
        if (offeringCurrency.equals(requestingCurrency)) {
            throw new InvalidOperationException("Offered and requested currencies must differ: " + offeringCurrency);
        }
        return new TradeOffer(id, creatorId, offeringCurrency, offeringAmount,
            requestingCurrency, requestingAmount, OfferStatus.ACTIVE, null, now, now);
    }

    /**
     * ACTIVE -> COMPLETED.
     *
     * @throws InvalidOperationException if the acceptor is the creator, whatever the status
     * @throws OfferNotActiveException if the offer is already terminal
     */
    public TradeOffer complete(UUID acceptorId, Instant now) {
        if (creatorId.equals(acceptorId)) {
            throw new InvalidOperationException("Cannot accept your own offer " + id);
        }
        requireTransition(OfferStatus.COMPLETED);
        return new TradeOffer(id, creatorId, offeringCurrency, offeringAmount,
            requestingCurrency, requestingAmount, OfferStatus.COMPLETED, acceptorId, createdAt, now);
    }

    /**
     * ACTIVE -> CANCELLED.
     *
     * @throws InvalidOperationException if the requester is not the creator
     * @throws OfferNotActiveException if the offer is already terminal
     */
    public TradeOffer cancel(UUID requesterId, Instant now) {
        if (!creatorId.equals(requesterId)) {
            throw new InvalidOperationException("Only the creator can cancel offer " + id);
        }
        requireTransition(OfferStatus.CANCELLED);
        return new TradeOffer(id, creatorId, offeringCurrency, offeringAmount,
            requestingCurrency, requestingAmount, OfferStatus.CANCELLED, null, createdAt, now);
    }

    public boolean canTransitionTo(OfferStatus target) {
        return switch (status) {
            case ACTIVE -> target == OfferStatus.COMPLETED || target == OfferStatus.CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    private void requireTransition(OfferStatus target) {
        if (!canTransitionTo(target)) {
            throw new OfferNotActiveException(id, status);
        }
    }
}
