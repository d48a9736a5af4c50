package com.gaming.loyalty.player;

/**
 * Supplies the player state rules are evaluated against.
 */
public interface PlayerStateProvider {

    /**
     * @throws com.gaming.loyalty.exception.NotFoundException if the player does not exist
     */
    PlayerState getPlayerState(String playerId);
}
