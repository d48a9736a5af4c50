package com.gaming.loyalty.domain;

/**
 * Currencies held or journaled by the wallet ledger. Only the first four carry a wallet balance;
 * CASH rows are audit entries for activity that settles outside the loyalty wallet.
 */
public enum CurrencyType {
    /** Loyalty points (LP), tracked in FIFO point entries with optional expiry. */
    LOYALTY_POINTS("LP"),
    /** Reward points (RP). */
    REWARD_POINTS("RP"),
    /** Bonus balance, subject to wagering requirements and bonus expiry. */
    BONUS_BALANCE("BONUS"),
    /** Tickets for draws and tournaments. */
    TICKETS("TICKETS"),
    /** Real money activity (deposits, withdrawals, wagers, wins, cash redemptions). Journal only. */
    CASH("CASH");

    private final String code;

    CurrencyType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean hasWalletBalance() {
        return this != CASH;
    }
}
