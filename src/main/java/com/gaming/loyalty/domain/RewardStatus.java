package com.gaming.loyalty.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a reward record. Status only moves forward:
 * PENDING to ACTIVE or CANCELLED, ACTIVE to COMPLETED or EXPIRED.
 */
public enum RewardStatus {
    /** Created by the rules engine, not yet credited to the wallet. */
    PENDING,
    /** Credited to the wallet. */
    ACTIVE,
    /** Bonus wagering requirement met. */
    COMPLETED,
    /** Bonus expired before its wagering requirement was met. */
    EXPIRED,
    /** Withdrawn before issuance (e.g. rejected by the safety gate). */
    CANCELLED;

    public boolean canTransitionTo(RewardStatus target) {
        return switch (this) {
            case PENDING -> target == ACTIVE || target == CANCELLED;
            case ACTIVE -> target == COMPLETED || target == EXPIRED;
            case COMPLETED, EXPIRED, CANCELLED -> false;
        };
    }

    /** Statuses of rewards that have reached the wallet; these count toward issuance caps. */
    public static Set<RewardStatus> issued() {
        return EnumSet.of(ACTIVE, COMPLETED, EXPIRED);
    }
}
