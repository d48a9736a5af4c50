package com.gaming.loyalty.persistence.entity;

import com.gaming.loyalty.domain.PlayerSegment;
import com.gaming.loyalty.domain.TierLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Player profile as maintained by the upstream player platform. The loyalty engine reads it and
 * writes back only the tier, risk score and blocked flag.
 */
@Entity
@Table(name = "players", indexes = {
    @Index(name = "idx_player_segment", columnList = "segment"),
    @Index(name = "idx_player_tier", columnList = "tier")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerEntity {

    @Id
    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "segment", length = 20)
    private PlayerSegment segment;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 20)
    @Builder.Default
    private TierLevel tier = TierLevel.BRONZE;

    @Column(name = "risk_score", nullable = false)
    private int riskScore;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "is_blocked", nullable = false)
    private boolean blocked;

    @Column(name = "kyc_completed", nullable = false)
    private boolean kycCompleted;

    @Column(name = "session_count", nullable = false)
    private int sessionCount;

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
