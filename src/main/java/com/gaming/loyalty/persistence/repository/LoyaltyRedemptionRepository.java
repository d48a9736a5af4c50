package com.gaming.loyalty.persistence.repository;

import com.gaming.loyalty.persistence.entity.LoyaltyRedemptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface LoyaltyRedemptionRepository extends JpaRepository<LoyaltyRedemptionEntity, Long> {

    @Query("SELECT COUNT(r) FROM LoyaltyRedemptionEntity r WHERE r.playerId = :playerId AND r.redemptionRuleId = :ruleId AND r.createdAt >= :since")
    long countByPlayerAndRuleSince(@Param("playerId") String playerId,
                                   @Param("ruleId") Long redemptionRuleId,
                                   @Param("since") Instant since);
}
