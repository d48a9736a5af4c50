package com.gaming.loyalty.domain;

/**
 * Behavioural segment supplied by the upstream segmentation job.
 */
public enum PlayerSegment {
    NEW,
    WINNING,
    BREAKEVEN,
    LOSING,
    VIP
}
