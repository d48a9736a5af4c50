package com.gaming.loyalty.persistence.repository;

import com.gaming.loyalty.persistence.entity.RedemptionRuleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RedemptionRuleRepository extends JpaRepository<RedemptionRuleEntity, Long> {
}
