package com.flagship.crypto_ledger.offer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface P2PSettlementRepository extends JpaRepository<P2PSettlementEntity, UUID> {

    Optional<P2PSettlementEntity> findByOfferId(UUID offerId);

    long countByOfferId(UUID offerId);
}
