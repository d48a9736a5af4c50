package com.gaming.loyalty.domain;

/**
 * Ledger row types. Player activity (deposits, wagers, wins, withdrawals) is journaled
 * alongside wallet mutations so the safety gate and abuse detectors can read it back.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    WAGER,
    WIN,
    BONUS_ISSUED,
    BONUS_DEBITED,
    BONUS_EXPIRED,
    LP_EARNED,
    LP_REDEEMED,
    LP_EXPIRED,
    RP_EARNED,
    RP_REDEEMED,
    TICKETS_ISSUED,
    TICKETS_REDEEMED,
    CASH_REDEMPTION;

    public boolean isPlayerActivity() {
        return this == DEPOSIT || this == WITHDRAWAL || this == WAGER || this == WIN;
    }
}
