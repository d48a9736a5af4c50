package com.gaming.loyalty.domain;

/**
 * Outcome of applying the abuse score to a player.
 */
public enum PenaltyAction {
    /** Score at or below the reduced-rewards threshold. */
    NO_ACTION,
    /** Future rewards should be reduced. */
    REDUCED_REWARDS,
    /** Future bonuses should carry higher wagering requirements. */
    INCREASED_WAGERING,
    /** Player is blocked from the loyalty program. */
    BLOCKED
}
