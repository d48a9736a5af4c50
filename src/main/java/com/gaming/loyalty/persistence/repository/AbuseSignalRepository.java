package com.gaming.loyalty.persistence.repository;

import com.gaming.loyalty.persistence.entity.AbuseSignalEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AbuseSignalRepository extends JpaRepository<AbuseSignalEntity, Long> {

    List<AbuseSignalEntity> findByPlayerIdAndResolvedFalse(String playerId);
}
