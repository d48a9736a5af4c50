package com.gaming.loyalty.persistence.entity;

import com.gaming.loyalty.domain.CurrencyType;
import com.gaming.loyalty.persistence.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One wallet per player: a balance per wallet currency plus the state of the current bonus
 * (wagering progress, expiry and play restrictions). Balances never go negative.
 */
@Entity
@Table(name = "wallet_balances", uniqueConstraints = {
    @UniqueConstraint(name = "uk_wallet_player", columnNames = "player_id")
}, indexes = {
    @Index(name = "idx_wallet_bonus_expiry", columnList = "bonus_expiry")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletBalanceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Column(name = "lp_balance", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal lpBalance = BigDecimal.ZERO;

    @Column(name = "rp_balance", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal rpBalance = BigDecimal.ZERO;

    @Column(name = "bonus_balance", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal bonusBalance = BigDecimal.ZERO;

    @Column(name = "tickets_balance", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal ticketsBalance = BigDecimal.ZERO;

    @Column(name = "bonus_wagering_required", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal bonusWageringRequired = BigDecimal.ZERO;

    @Column(name = "bonus_wagering_completed", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal bonusWageringCompleted = BigDecimal.ZERO;

    @Column(name = "bonus_expiry")
    private Instant bonusExpiry;

    @Column(name = "bonus_max_bet", precision = 19, scale = 4)
    private BigDecimal bonusMaxBet;

    @Convert(converter = StringListConverter.class)
    @Column(name = "bonus_eligible_games", length = 2000)
    private List<String> bonusEligibleGames;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public BigDecimal getBalance(CurrencyType currency) {
        return switch (currency) {
            case LOYALTY_POINTS -> lpBalance;
            case REWARD_POINTS -> rpBalance;
            case BONUS_BALANCE -> bonusBalance;
            case TICKETS -> ticketsBalance;
            case CASH -> throw new IllegalArgumentException("CASH has no wallet balance");
        };
    }

    public void setBalance(CurrencyType currency, BigDecimal amount) {
        if (amount.signum() < 0) {
            throw new IllegalStateException("Negative " + currency.getCode() + " balance for player " + playerId);
        }
        switch (currency) {
            case LOYALTY_POINTS -> lpBalance = amount;
            case REWARD_POINTS -> rpBalance = amount;
            case BONUS_BALANCE -> bonusBalance = amount;
            case TICKETS -> ticketsBalance = amount;
            case CASH -> throw new IllegalArgumentException("CASH has no wallet balance");
        }
    }

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
