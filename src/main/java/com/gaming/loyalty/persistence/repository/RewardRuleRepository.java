package com.gaming.loyalty.persistence.repository;

import com.gaming.loyalty.persistence.entity.RewardRuleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RewardRuleRepository extends JpaRepository<RewardRuleEntity, String> {

    /** Highest priority first; equal priorities keep creation order. */
    @Query("SELECT r FROM RewardRuleEntity r WHERE r.active = true ORDER BY r.priority DESC, r.createdAt ASC, r.ruleId ASC")
    List<RewardRuleEntity> findActiveOrderByPriority();

    List<RewardRuleEntity> findAllByOrderByPriorityDescCreatedAtAsc();
}
