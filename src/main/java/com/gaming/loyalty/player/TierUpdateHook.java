package com.gaming.loyalty.player;

import com.gaming.loyalty.domain.TierLevel;

/**
 * Recomputes a player's loyalty tier. Called after loyalty points are credited; failures are
 * logged by the caller and never undo the credit.
 */
public interface TierUpdateHook {

    TierLevel updatePlayerTier(String playerId);
}
