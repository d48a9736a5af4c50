package com.gaming.loyalty.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A lot of loyalty points from one credit. Debits consume lots oldest first; remaining only goes down.
 */
@Entity
@Table(name = "loyalty_point_entries", indexes = {
    @Index(name = "idx_point_entry_player_issued", columnList = "player_id, issued_at"),
    @Index(name = "idx_point_entry_expiry", columnList = "is_expired, expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Column(name = "amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "remaining_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal remainingAmount;

    @Column(name = "source_type", length = 50)
    private String sourceType;

    @Column(name = "source_id", length = 100)
    private String sourceId;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "is_expired", nullable = false)
    private boolean expired;

    @PrePersist
    protected void onCreate() {
        if (issuedAt == null) {
            issuedAt = Instant.now();
        }
    }
}
