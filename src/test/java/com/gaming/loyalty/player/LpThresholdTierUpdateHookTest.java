package com.gaming.loyalty.player;

import com.gaming.loyalty.config.LoyaltyProperties;
import com.gaming.loyalty.domain.TierLevel;
import com.gaming.loyalty.persistence.entity.PlayerEntity;
import com.gaming.loyalty.persistence.entity.WalletBalanceEntity;
import com.gaming.loyalty.persistence.repository.PlayerRepository;
import com.gaming.loyalty.persistence.repository.WalletBalanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LpThresholdTierUpdateHookTest {

    @Mock private PlayerRepository playerRepository;
    @Mock private WalletBalanceRepository balanceRepository;

    private LpThresholdTierUpdateHook hook;

    @BeforeEach
    void setUp() {
        hook = new LpThresholdTierUpdateHook(playerRepository, balanceRepository, new LoyaltyProperties());
    }

    @Test
    void thresholdsAreInclusive() {
        assertThat(hook.tierFor(new BigDecimal("999"))).isEqualTo(TierLevel.BRONZE);
        assertThat(hook.tierFor(new BigDecimal("1000"))).isEqualTo(TierLevel.SILVER);
        assertThat(hook.tierFor(new BigDecimal("10000"))).isEqualTo(TierLevel.GOLD);
        assertThat(hook.tierFor(new BigDecimal("50000"))).isEqualTo(TierLevel.PLATINUM);
        assertThat(hook.tierFor(new BigDecimal("250000"))).isEqualTo(TierLevel.DIAMOND);
    }

    @Test
    void promotesPlayerWhenBalanceCrossesThreshold() {
        PlayerEntity player = PlayerEntity.builder().playerId("p1").tier(TierLevel.BRONZE).build();
        when(playerRepository.findById("p1")).thenReturn(Optional.of(player));
        when(balanceRepository.findByPlayerId("p1")).thenReturn(Optional.of(
                WalletBalanceEntity.builder().playerId("p1").lpBalance(new BigDecimal("12000")).build()));

        assertThat(hook.updatePlayerTier("p1")).isEqualTo(TierLevel.GOLD);
        assertThat(player.getTier()).isEqualTo(TierLevel.GOLD);
        verify(playerRepository).save(player);
    }

    @Test
    void unchangedTierIsNotSaved() {
        PlayerEntity player = PlayerEntity.builder().playerId("p1").tier(TierLevel.SILVER).build();
        when(playerRepository.findById("p1")).thenReturn(Optional.of(player));
        when(balanceRepository.findByPlayerId("p1")).thenReturn(Optional.of(
                WalletBalanceEntity.builder().playerId("p1").lpBalance(new BigDecimal("1500")).build()));

        assertThat(hook.updatePlayerTier("p1")).isEqualTo(TierLevel.SILVER);
        verify(playerRepository, never()).save(any());
    }

    @Test
    void missingPlayerDefaultsToBronze() {
        when(playerRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThat(hook.updatePlayerTier("ghost")).isEqualTo(TierLevel.BRONZE);
        verifyNoInteractions(balanceRepository);
    }
}
