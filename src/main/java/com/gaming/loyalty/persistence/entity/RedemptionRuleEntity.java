package com.gaming.loyalty.persistence.entity;

import com.gaming.loyalty.domain.RedemptionTarget;
import com.gaming.loyalty.domain.TierLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Conversion of loyalty points into cash or bonus value.
 */
@Entity
@Table(name = "redemption_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RedemptionRuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "lp_cost", nullable = false, precision = 19, scale = 4)
    private BigDecimal lpCost;

    @Column(name = "currency_value", nullable = false, precision = 19, scale = 4)
    private BigDecimal currencyValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_balance", nullable = false, length = 10)
    private RedemptionTarget targetBalance;

    @Column(name = "min_lp_balance", precision = 19, scale = 4)
    private BigDecimal minLpBalance;

    @Column(name = "max_redemptions_per_month")
    private Integer maxRedemptionsPerMonth;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier_requirement", length = 20)
    private TierLevel tierRequirement;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
