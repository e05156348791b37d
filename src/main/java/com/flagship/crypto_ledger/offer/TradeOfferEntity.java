package com.flagship.crypto_ledger.offer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of trade_offers.
 *
 * No setters: the terms are updatable = false and status only moves through
 * {@link #updateFromDomain(TradeOffer)}, so every change passes the TradeOffer
 * state machine first. A database trigger additionally freezes terminal rows.
 */
@Entity
@Table(name = "trade_offers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TradeOfferEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "creator_id", nullable = false, updatable = false)
    private UUID creatorId;

    @Column(name = "offering_currency", nullable = false, updatable = false, length = 16)
    private String offeringCurrency;

    @Column(name = "offering_amount", nullable = false, updatable = false, precision = 28, scale = 8)
    private BigDecimal offeringAmount;

    @Column(name = "requesting_currency", nullable = false, updatable = false, length = 16)
    private String requestingCurrency;

    @Column(name = "requesting_amount", nullable = false, updatable = false, precision = 28, scale = 8)
    private BigDecimal requestingAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OfferStatus status;

    @Column(name = "accepted_by")
    private UUID acceptedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static TradeOfferEntity fromDomain(TradeOffer offer) {
        TradeOfferEntity entity = new TradeOfferEntity();
        entity.id = offer.getId();
        entity.creatorId = offer.getCreatorId();
        entity.offeringCurrency = offer.getOfferingCurrency();
        entity.offeringAmount = offer.getOfferingAmount();
        entity.requestingCurrency = offer.getRequestingCurrency();
        entity.requestingAmount = offer.getRequestingAmount();
        entity.status = offer.getStatus();
        entity.acceptedBy = offer.getAcceptedBy();
        entity.createdAt = offer.getCreatedAt();
        entity.updatedAt = offer.getUpdatedAt();
        return entity;
    }

    public TradeOffer toDomain() {
        return new TradeOffer(id, creatorId, offeringCurrency, offeringAmount,
            requestingCurrency, requestingAmount, status, acceptedBy, createdAt, updatedAt);
    }

    /**
     * Copies the mutable part of a transitioned offer onto this row.
     */
    public void updateFromDomain(TradeOffer offer) {
        if (!id.equals(offer.getId())) {
            throw new IllegalArgumentException("Offer id mismatch: " + id + " vs " + offer.getId());
        }
        this.status = offer.getStatus();
        this.acceptedBy = offer.getAcceptedBy();
        this.updatedAt = offer.getUpdatedAt();
    }
}
