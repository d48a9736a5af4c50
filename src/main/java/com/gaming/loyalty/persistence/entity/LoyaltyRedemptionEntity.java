package com.gaming.loyalty.persistence.entity;

import com.gaming.loyalty.domain.CurrencyType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Audit row for a completed LP redemption.
 */
@Entity
@Table(name = "loyalty_redemptions", indexes = {
    @Index(name = "idx_redemption_player_rule", columnList = "player_id, redemption_rule_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoyaltyRedemptionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Column(name = "redemption_rule_id", nullable = false)
    private Long redemptionRuleId;

    @Column(name = "lp_spent", nullable = false, precision = 19, scale = 4)
    private BigDecimal lpSpent;

    @Column(name = "value_received", nullable = false, precision = 19, scale = 4)
    private BigDecimal valueReceived;

    @Enumerated(EnumType.STRING)
    @Column(name = "currency_type", nullable = false, length = 20)
    private CurrencyType currencyType;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
