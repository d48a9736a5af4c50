package com.gaming.loyalty.persistence.repository;

import com.gaming.loyalty.domain.TransactionType;
import com.gaming.loyalty.persistence.entity.LedgerTransactionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Repository for ledger rows. Aggregates return null when no row matches.
 */
@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransactionEntity, Long> {

    List<LedgerTransactionEntity> findByPlayerIdOrderByCreatedAtAscIdAsc(String playerId);

    List<LedgerTransactionEntity> findByReferenceId(String referenceId);

    @Query("SELECT SUM(t.amount) FROM LedgerTransactionEntity t WHERE t.playerId = :playerId AND t.transactionType = :type")
    BigDecimal sumAmountByPlayerAndType(@Param("playerId") String playerId, @Param("type") TransactionType type);

    @Query("SELECT SUM(t.amount) FROM LedgerTransactionEntity t WHERE t.playerId = :playerId AND t.transactionType = :type AND t.createdAt >= :since")
    BigDecimal sumAmountByPlayerAndTypeSince(@Param("playerId") String playerId,
                                             @Param("type") TransactionType type,
                                             @Param("since") Instant since);

    @Query("SELECT COUNT(t) FROM LedgerTransactionEntity t WHERE t.playerId = :playerId AND t.transactionType = :type")
    long countByPlayerAndType(@Param("playerId") String playerId, @Param("type") TransactionType type);

    @Query("SELECT COUNT(t) FROM LedgerTransactionEntity t WHERE t.playerId = :playerId AND t.transactionType = :type AND t.createdAt >= :since")
    long countByPlayerAndTypeSince(@Param("playerId") String playerId,
                                   @Param("type") TransactionType type,
                                   @Param("since") Instant since);

    @Query("SELECT MAX(t.createdAt) FROM LedgerTransactionEntity t WHERE t.playerId = :playerId AND t.transactionType = :type")
    Instant findLatestCreatedAt(@Param("playerId") String playerId, @Param("type") TransactionType type);

    /** Most recent first; page size bounds the sample. */
    @Query("SELECT t FROM LedgerTransactionEntity t WHERE t.playerId = :playerId AND t.transactionType = :type ORDER BY t.createdAt DESC, t.id DESC")
    List<LedgerTransactionEntity> findRecentByPlayerAndType(@Param("playerId") String playerId,
                                                            @Param("type") TransactionType type,
                                                            Pageable pageable);
}
