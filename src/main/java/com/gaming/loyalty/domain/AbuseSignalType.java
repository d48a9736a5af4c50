package com.gaming.loyalty.domain;

/**
 * Type of abuse signal raised by the abuse scorer, with its fixed severity (1 to 10).
 */
public enum AbuseSignalType {
    /** Bonus rewards received exceed total deposits. */
    BONUS_ONLY_PLAY(5),
    /** Withdrawal shortly after receiving a reward. */
    IMMEDIATE_WITHDRAWAL(7),
    /** Extreme variance between largest and smallest recent wager. */
    BET_MANIPULATION(8),
    /** Winnings far above wagered amount over a meaningful volume. */
    ABNORMAL_WIN_RATE(9),
    /** Raised by an operator. */
    MANUAL_REVIEW_REQUIRED(10);

    private final int severity;

    AbuseSignalType(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }
}
