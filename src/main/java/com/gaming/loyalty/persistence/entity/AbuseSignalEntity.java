package com.gaming.loyalty.persistence.entity;

import com.gaming.loyalty.domain.AbuseSignalType;
import com.gaming.loyalty.persistence.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Abuse signal raised against a player. Unresolved signals feed the abuse score.
 */
@Entity
@Table(name = "abuse_signals", indexes = {
    @Index(name = "idx_abuse_player_resolved", columnList = "player_id, is_resolved"),
    @Index(name = "idx_abuse_detected_at", columnList = "detected_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AbuseSignalEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "signal_type", nullable = false, length = 40)
    private AbuseSignalType signalType;

    @Column(name = "severity", nullable = false)
    private int severity;

    @Column(name = "description", length = 1000)
    private String description;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 4000)
    private Map<String, Object> metadata;

    @Column(name = "is_resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolution_notes", length = 1000)
    private String resolutionNotes;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @PrePersist
    protected void onCreate() {
        if (detectedAt == null) {
            detectedAt = Instant.now();
        }
    }
}
