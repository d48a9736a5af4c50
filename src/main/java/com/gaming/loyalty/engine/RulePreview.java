package com.gaming.loyalty.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Dry-run result of a rule against one player: whether it matches, the capped amount it would grant
 * and the state it was evaluated on. Nothing is persisted.
 */
@Value
@Builder
public class RulePreview {
    String ruleId;
    String playerId;
    boolean matches;
    BigDecimal rawAmount;
    BigDecimal cappedAmount;
    Map<String, Object> playerState;
}
