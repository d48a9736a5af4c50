package com.gaming.loyalty.safety;

import com.gaming.loyalty.config.LoyaltyProperties;

import java.math.BigDecimal;

/**
 * Trailing windows over which issued rewards are capped per player.
 */
public enum RewardCapPeriod {
    DAILY("Daily", 1),
    WEEKLY("Weekly", 7),
    MONTHLY("Monthly", 30);

    private final String label;
    private final int days;

    RewardCapPeriod(String label, int days) {
        this.label = label;
        this.days = days;
    }

    public String getLabel() {
        return label;
    }

    public int getDays() {
        return days;
    }

    BigDecimal cap(LoyaltyProperties.Safety safety) {
        return switch (this) {
            case DAILY -> safety.getDailyCap();
            case WEEKLY -> safety.getWeeklyCap();
            case MONTHLY -> safety.getMonthlyCap();
        };
    }
}
