package com.flagship.crypto_ledger.offer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "p2p_settlements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class P2PSettlementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "offer_id", nullable = false, updatable = false, unique = true)
    private UUID offerId;

    @Column(name = "creator_id", nullable = false, updatable = false)
    private UUID creatorId;

    @Column(name = "acceptor_id", nullable = false, updatable = false)
    private UUID acceptorId;

    @Column(name = "offering_currency", nullable = false, updatable = false, length = 16)
    private String offeringCurrency;

    @Column(name = "offering_amount", nullable = false, updatable = false, precision = 28, scale = 8)
    private BigDecimal offeringAmount;

    @Column(name = "requesting_currency", nullable = false, updatable = false, length = 16)
    private String requestingCurrency;

    @Column(name = "requesting_amount", nullable = false, updatable = false, precision = 28, scale = 8)
    private BigDecimal requestingAmount;

    @Column(name = "settled_at", nullable = false, updatable = false)
    private Instant settledAt;

    public static P2PSettlementEntity fromDomain(P2PSettlement settlement) {
        P2PSettlementEntity entity = new P2PSettlementEntity();
        entity.id = settlement.getId();
        entity.offerId = settlement.getOfferId();
        entity.creatorId = settlement.getCreatorId();
        entity.acceptorId = settlement.getAcceptorId();
        entity.offeringCurrency = settlement.getOfferingCurrency();
        entity.offeringAmount = settlement.getOfferingAmount();
        entity.requestingCurrency = settlement.getRequestingCurrency();
        entity.requestingAmount = settlement.getRequestingAmount();
        entity.settledAt = settlement.getSettledAt();
        return entity;
    }

    public P2PSettlement toDomain() {
        return new P2PSettlement(id, offerId, creatorId, acceptorId, offeringCurrency, offeringAmount,
            requestingCurrency, requestingAmount, settledAt);
    }
}
