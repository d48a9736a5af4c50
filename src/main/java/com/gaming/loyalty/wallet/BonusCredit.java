package com.gaming.loyalty.wallet;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A bonus balance credit with its play restrictions. Null restrictions leave the wallet's current ones in place.
 */
@Value
@Builder
public class BonusCredit {
    BigDecimal amount;
    /** Absolute amount to wager before the bonus is released; added to any outstanding requirement. */
    BigDecimal wageringRequirement;
    Instant expiry;
    BigDecimal maxBet;
    List<String> eligibleGames;
    String referenceId;
    String description;
}
