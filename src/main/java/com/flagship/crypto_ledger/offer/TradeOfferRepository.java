package com.flagship.crypto_ledger.offer;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TradeOfferRepository extends JpaRepository<TradeOfferEntity, UUID> {

    /**
     * SELECT ... FOR UPDATE on the offer row. Accept and cancel take this lock
     * before any wallet lock, so concurrent transitions of one offer serialize here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM TradeOfferEntity o WHERE o.id = :id")
    Optional<TradeOfferEntity> findByIdForUpdate(@Param("id") UUID id);

    List<TradeOfferEntity> findByStatusOrderByCreatedAtDesc(OfferStatus status, Pageable pageable);

    List<TradeOfferEntity> findByStatusAndCreatorIdNotOrderByCreatedAtDesc(OfferStatus status, UUID creatorId,
                                                                         Pageable pageable);

    List<TradeOfferEntity> findByCreatorIdAndStatusOrderByCreatedAtDesc(UUID creatorId, OfferStatus status);

    long countByStatus(OfferStatus status);

    /**
     * Escrowed total per (creator, currency) over offers in the given status.
     */
    @Query("""
        SELECT o.creatorId AS accountId, o.offeringCurrency AS currency, SUM(o.offeringAmount) AS total
        FROM TradeOfferEntity o
        WHERE o.status = :status
        GROUP BY o.creatorId, o.offeringCurrency
        """)
    List<EscrowTotal> sumOfferedByCreatorAndCurrency(@Param("status") OfferStatus status);

    interface EscrowTotal {
        UUID getAccountId();

        String getCurrency();

        BigDecimal getTotal();
    }
}
