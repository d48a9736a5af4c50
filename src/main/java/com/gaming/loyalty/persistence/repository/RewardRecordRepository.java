package com.gaming.loyalty.persistence.repository;

import com.gaming.loyalty.domain.CurrencyType;
import com.gaming.loyalty.domain.RewardStatus;
import com.gaming.loyalty.persistence.entity.RewardRecordEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface RewardRecordRepository extends JpaRepository<RewardRecordEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RewardRecordEntity r WHERE r.id = :id")
    Optional<RewardRecordEntity> findByIdForUpdate(@Param("id") Long id);

    List<RewardRecordEntity> findByPlayerIdOrderByCreatedAtDesc(String playerId);

    List<RewardRecordEntity> findByPlayerIdAndStatusAndCurrencyType(String playerId, RewardStatus status, CurrencyType currencyType);

    @Query("SELECT SUM(r.amount) FROM RewardRecordEntity r WHERE r.playerId = :playerId AND r.status IN :statuses AND r.issuedAt >= :since")
    BigDecimal sumIssuedAmountSince(@Param("playerId") String playerId,
                                    @Param("statuses") Collection<RewardStatus> statuses,
                                    @Param("since") Instant since);

    @Query("SELECT COUNT(r) FROM RewardRecordEntity r WHERE r.playerId = :playerId AND r.status IN :statuses AND r.issuedAt >= :since")
    long countIssuedSince(@Param("playerId") String playerId,
                          @Param("statuses") Collection<RewardStatus> statuses,
                          @Param("since") Instant since);
}
