package com.gaming.loyalty.persistence.entity;

import com.gaming.loyalty.domain.CurrencyType;
import com.gaming.loyalty.domain.TransactionType;
import com.gaming.loyalty.persistence.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Append-only ledger row. Amount is signed; balance before/after bracket the same operation's delta.
 */
@Entity
@Immutable
@Table(name = "ledger_transactions", indexes = {
    @Index(name = "idx_ledger_player_type_created", columnList = "player_id, transaction_type, created_at"),
    @Index(name = "idx_ledger_reference", columnList = "reference_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 30)
    private TransactionType transactionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "currency_type", nullable = false, length = 20)
    private CurrencyType currencyType;

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "balance_before", nullable = false, precision = 19, scale = 4)
    private BigDecimal balanceBefore;

    @Column(name = "balance_after", nullable = false, precision = 19, scale = 4)
    private BigDecimal balanceAfter;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "reference_id", length = 100)
    private String referenceId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 4000)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
