package com.flagship.crypto_ledger.trading;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TradeTransactionRepository extends JpaRepository<TradeTransactionEntity, UUID> {

    List<TradeTransactionEntity> findByAccountIdOrderByExecutedAtDesc(UUID accountId, Pageable pageable);

    List<TradeTransactionEntity> findByAccountIdAndPairOrderByExecutedAtDesc(UUID accountId, String pair,
                                                                            Pageable pageable);
}
