package com.gaming.loyalty.domain;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Keys and typed readers for the metadata snapshot stored on each reward record.
 */
public final class RewardMetadata {

    public static final String RULE_NAME = "rule_name";
    public static final String PLAYER_SEGMENT = "player_segment";
    public static final String PLAYER_TIER = "player_tier";
    public static final String ELIGIBLE_GAMES = "eligible_games";
    public static final String MAX_BET = "max_bet";
    public static final String LP_EXPIRY_DAYS = "lp_expiry_days";

    private RewardMetadata() {
    }

    public static BigDecimal maxBet(Map<String, Object> metadata) {
        return metadata == null ? null : Amounts.toBigDecimal(metadata.get(MAX_BET));
    }

    public static Integer lpExpiryDays(Map<String, Object> metadata) {
        if (metadata == null) {
            return null;
        }
        Object value = metadata.get(LP_EXPIRY_DAYS);
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    public static List<String> eligibleGames(Map<String, Object> metadata) {
        if (metadata == null || !(metadata.get(ELIGIBLE_GAMES) instanceof List)) {
            return Collections.emptyList();
        }
        List<?> games = (List<?>) metadata.get(ELIGIBLE_GAMES);
        List<String> result = new ArrayList<>(games.size());
        for (Object game : games) {
            if (game != null) {
                result.add(game.toString());
            }
        }
        return result;
    }
}
