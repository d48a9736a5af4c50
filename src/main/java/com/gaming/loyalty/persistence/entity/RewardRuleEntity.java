package com.gaming.loyalty.persistence.entity;

import com.gaming.loyalty.domain.RewardConfig;
import com.gaming.loyalty.persistence.converter.JsonMapConverter;
import com.gaming.loyalty.persistence.converter.RewardConfigConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A reward rule: a conjunction of conditions over player state and the reward to grant when they hold.
 */
@Entity
@Table(name = "reward_rules", indexes = {
    @Index(name = "idx_rule_active_priority", columnList = "is_active, priority")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewardRuleEntity {

    @Id
    @Column(name = "rule_id", nullable = false, length = 100)
    private String ruleId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    // Higher runs first
    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "conditions", nullable = false, length = 4000)
    private Map<String, Object> conditions;

    @Convert(converter = RewardConfigConverter.class)
    @Column(name = "reward_config", nullable = false, length = 4000)
    private RewardConfig rewardConfig;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
