package com.gaming.loyalty.domain;

/**
 * Loyalty tiers, declared lowest first. Declaration order is the tier ordering.
 */
public enum TierLevel {
    BRONZE,
    SILVER,
    GOLD,
    PLATINUM,
    DIAMOND;

    /** True when this tier is at or above {@code required}. */
    public boolean meets(TierLevel required) {
        return required == null || compareTo(required) >= 0;
    }
}
