package com.gaming.loyalty.persistence.repository;

import com.gaming.loyalty.persistence.entity.WalletBalanceEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for wallet balances. The {@code ForUpdate} finders take a row lock that serializes
 * every mutation of one player's wallet until the surrounding transaction ends.
 */
@Repository
public interface WalletBalanceRepository extends JpaRepository<WalletBalanceEntity, Long> {

    Optional<WalletBalanceEntity> findByPlayerId(String playerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WalletBalanceEntity w WHERE w.playerId = :playerId")
    Optional<WalletBalanceEntity> findByPlayerIdForUpdate(@Param("playerId") String playerId);

    /** Candidates only; the expiry condition is checked again under the row lock. */
    @Query("SELECT w.playerId FROM WalletBalanceEntity w WHERE w.bonusBalance > 0 AND w.bonusExpiry IS NOT NULL AND w.bonusExpiry <= :now ORDER BY w.id")
    List<String> findPlayerIdsWithExpiredBonus(@Param("now") Instant now);
}
