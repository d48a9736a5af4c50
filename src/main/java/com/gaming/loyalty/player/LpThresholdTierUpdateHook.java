package com.gaming.loyalty.player;

import com.gaming.loyalty.config.LoyaltyProperties;
import com.gaming.loyalty.domain.TierLevel;
import com.gaming.loyalty.persistence.entity.PlayerEntity;
import com.gaming.loyalty.persistence.entity.WalletBalanceEntity;
import com.gaming.loyalty.persistence.repository.PlayerRepository;
import com.gaming.loyalty.persistence.repository.WalletBalanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Default tier policy: the player's tier follows their current LP balance against the configured thresholds.
 * Runs in its own transaction so a failure cannot touch the credit that triggered it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LpThresholdTierUpdateHook implements TierUpdateHook {

    private final PlayerRepository playerRepository;
    private final WalletBalanceRepository balanceRepository;
    private final LoyaltyProperties properties;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TierLevel updatePlayerTier(String playerId) {
        PlayerEntity player = playerRepository.findById(playerId).orElse(null);
        if (player == null) {
            log.debug("No player profile for tier update: playerId={}", playerId);
            return TierLevel.BRONZE;
        }
        BigDecimal lp = balanceRepository.findByPlayerId(playerId)
                .map(WalletBalanceEntity::getLpBalance)
                .orElse(BigDecimal.ZERO);
        TierLevel tier = tierFor(lp);
        if (tier != player.getTier()) {
            log.info("Tier changed: playerId={}, from={}, to={}, lpBalance={}", playerId, player.getTier(), tier, lp);
            player.setTier(tier);
            playerRepository.save(player);
        }
        return tier;
    }

    TierLevel tierFor(BigDecimal lp) {
        LoyaltyProperties.Tiers tiers = properties.getTiers();
        if (lp.compareTo(tiers.getDiamondLp()) >= 0) {
            return TierLevel.DIAMOND;
        }
        if (lp.compareTo(tiers.getPlatinumLp()) >= 0) {
            return TierLevel.PLATINUM;
        }
        if (lp.compareTo(tiers.getGoldLp()) >= 0) {
            return TierLevel.GOLD;
        }
        if (lp.compareTo(tiers.getSilverLp()) >= 0) {
            return TierLevel.SILVER;
        }
        return TierLevel.BRONZE;
    }
}
