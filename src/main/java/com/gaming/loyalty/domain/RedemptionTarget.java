package com.gaming.loyalty.domain;

/** Where the value of an LP redemption is credited. */
public enum RedemptionTarget {
    CASH,
    BONUS
}
