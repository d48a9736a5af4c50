package com.gaming.loyalty.persistence.entity;

import com.gaming.loyalty.domain.CurrencyType;
import com.gaming.loyalty.domain.RewardStatus;
import com.gaming.loyalty.domain.RewardType;
import com.gaming.loyalty.persistence.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * A reward granted to a player by a rule. Amount, type and the metadata snapshot are fixed at creation;
 * only status, wagering progress and lifecycle timestamps change afterwards.
 */
@Entity
@Table(name = "reward_records", indexes = {
    @Index(name = "idx_reward_player_status", columnList = "player_id, status"),
    @Index(name = "idx_reward_player_issued", columnList = "player_id, issued_at"),
    @Index(name = "idx_reward_rule", columnList = "rule_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewardRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, updatable = false, length = 64)
    private String playerId;

    @Column(name = "rule_id", nullable = false, updatable = false, length = 100)
    private String ruleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reward_type", nullable = false, updatable = false, length = 30)
    private RewardType rewardType;

    @Enumerated(EnumType.STRING)
    @Column(name = "currency_type", nullable = false, updatable = false, length = 20)
    private CurrencyType currencyType;

    @Column(name = "amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RewardStatus status;

    @Column(name = "wagering_required", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal wageringRequired = BigDecimal.ZERO;

    @Column(name = "wagering_completed", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal wageringCompleted = BigDecimal.ZERO;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "issued_at")
    private Instant issuedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 4000, updatable = false)
    private Map<String, Object> metadata;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
