package com.gaming.loyalty.persistence.repository;

import com.gaming.loyalty.persistence.entity.PointEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Repository
public interface PointEntryRepository extends JpaRepository<PointEntryEntity, Long> {

    List<PointEntryEntity> findByPlayerIdOrderByIssuedAtAscIdAsc(String playerId);

    /** Oldest first; ties on issue time fall back to insertion order. */
    @Query("SELECT e FROM PointEntryEntity e WHERE e.playerId = :playerId AND e.expired = false AND e.remainingAmount > 0 ORDER BY e.issuedAt ASC, e.id ASC")
    List<PointEntryEntity> findConsumableEntries(@Param("playerId") String playerId);

    @Query("SELECT SUM(e.remainingAmount) FROM PointEntryEntity e WHERE e.playerId = :playerId AND e.expired = false")
    BigDecimal sumRemainingByPlayer(@Param("playerId") String playerId);

    @Query("SELECT DISTINCT e.playerId FROM PointEntryEntity e WHERE e.expired = false AND e.remainingAmount > 0 AND e.expiresAt IS NOT NULL AND e.expiresAt <= :now ORDER BY e.playerId")
    List<String> findPlayerIdsWithDueEntries(@Param("now") Instant now);

    /** Read only while the player's wallet row is locked. */
    @Query("SELECT e FROM PointEntryEntity e WHERE e.playerId = :playerId AND e.expired = false AND e.remainingAmount > 0 AND e.expiresAt IS NOT NULL AND e.expiresAt <= :now ORDER BY e.issuedAt, e.id")
    List<PointEntryEntity> findDueForExpiry(@Param("playerId") String playerId, @Param("now") Instant now);
}
