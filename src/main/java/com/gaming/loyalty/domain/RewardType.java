package com.gaming.loyalty.domain;

import com.gaming.loyalty.exception.ConfigurationException;

import java.util.Locale;

/**
 * Reward kinds a rule can grant. Each maps to exactly one wallet currency.
 */
public enum RewardType {
    CASHBACK,
    BONUS_BALANCE,
    FREE_PLAY,
    LOYALTY_POINTS,
    REWARD_POINTS,
    TICKETS;

    /** Type used when a rule's reward config names none. */
    public static final RewardType DEFAULT = BONUS_BALANCE;

    public CurrencyType currency() {
        return switch (this) {
            case LOYALTY_POINTS -> CurrencyType.LOYALTY_POINTS;
            case REWARD_POINTS -> CurrencyType.REWARD_POINTS;
            case BONUS_BALANCE, FREE_PLAY, CASHBACK -> CurrencyType.BONUS_BALANCE;
            case TICKETS -> CurrencyType.TICKETS;
        };
    }

    /**
     * Resolves the {@code type} value of a rule's reward config.
     *
     * @throws ConfigurationException if the value names no known reward type
     */
    public static RewardType fromConfig(String value, String ruleId) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return RewardType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    "Unknown reward type '" + value + "' in reward config of rule " + ruleId, e);
        }
    }
}
