package com.gaming.loyalty.wallet;

import com.gaming.loyalty.config.LoyaltyProperties;
import com.gaming.loyalty.domain.CurrencyType;
import com.gaming.loyalty.domain.RewardStatus;
import com.gaming.loyalty.domain.TransactionType;
import com.gaming.loyalty.messaging.LedgerEventPublisher;
import com.gaming.loyalty.persistence.entity.LedgerTransactionEntity;
import com.gaming.loyalty.persistence.entity.PointEntryEntity;
import com.gaming.loyalty.persistence.entity.WalletBalanceEntity;
import com.gaming.loyalty.persistence.repository.LedgerTransactionRepository;
import com.gaming.loyalty.persistence.repository.LoyaltyRedemptionRepository;
import com.gaming.loyalty.persistence.repository.PointEntryRepository;
import com.gaming.loyalty.persistence.repository.RedemptionRuleRepository;
import com.gaming.loyalty.persistence.repository.RewardRecordRepository;
import com.gaming.loyalty.persistence.repository.WalletBalanceRepository;
import com.gaming.loyalty.player.PlayerStateProvider;
import com.gaming.loyalty.player.TierUpdateHook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Sweep bookkeeping with each per-player step run through a pass-through transaction template.
 */
@ExtendWith(MockitoExtension.class)
class WalletLedgerSweepTest {

    @Mock private WalletBalanceRepository balanceRepository;
    @Mock private PointEntryRepository pointEntryRepository;
    @Mock private LedgerTransactionRepository transactionRepository;
    @Mock private RewardRecordRepository rewardRepository;
    @Mock private RedemptionRuleRepository redemptionRuleRepository;
    @Mock private LoyaltyRedemptionRepository redemptionRepository;
    @Mock private PlayerStateProvider playerStateProvider;
    @Mock private TierUpdateHook tierUpdateHook;
    @Mock private LedgerEventPublisher eventPublisher;
    @Mock private TransactionTemplate transactionTemplate;

    private WalletLedger walletLedger;

    @BeforeEach
    void setUp() {
        walletLedger = new WalletLedger(balanceRepository, pointEntryRepository, transactionRepository, rewardRepository,
                redemptionRuleRepository, redemptionRepository, playerStateProvider, tierUpdateHook, eventPublisher,
                new LoyaltyProperties(), transactionTemplate);
        when(transactionTemplate.execute(any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(0);
            return callback.doInTransaction(null);
        });
    }

    private void echoSaves() {
        when(balanceRepository.save(any(WalletBalanceEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(transactionRepository.save(any(LedgerTransactionEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void bonusSweepContinuesPastFailingPlayer() {
        echoSaves();
        WalletBalanceEntity healthy = WalletBalanceEntity.builder()
                .playerId("p2")
                .bonusBalance(new BigDecimal("40"))
                .bonusExpiry(Instant.now().minus(1, ChronoUnit.HOURS))
                .build();
        when(balanceRepository.findPlayerIdsWithExpiredBonus(any(Instant.class))).thenReturn(List.of("p1", "p2"));
        when(balanceRepository.findByPlayerIdForUpdate("p1")).thenThrow(new CannotAcquireLockException("lock timeout"));
        when(balanceRepository.findByPlayerIdForUpdate("p2")).thenReturn(Optional.of(healthy));
        when(rewardRepository.findByPlayerIdAndStatusAndCurrencyType("p2", RewardStatus.ACTIVE, CurrencyType.BONUS_BALANCE))
                .thenReturn(List.of());

        assertThat(walletLedger.expireBonuses()).isEqualTo(1);
        assertThat(healthy.getBonusBalance()).isEqualByComparingTo("0");
        verify(transactionTemplate, times(2)).execute(any());
    }

    @Test
    void bonusExtendedAfterCandidateQueryIsLeftAlone() {
        WalletBalanceEntity extended = WalletBalanceEntity.builder()
                .playerId("p1")
                .bonusBalance(new BigDecimal("40"))
                .bonusExpiry(Instant.now().plus(1, ChronoUnit.DAYS))
                .build();
        when(balanceRepository.findPlayerIdsWithExpiredBonus(any(Instant.class))).thenReturn(List.of("p1"));
        when(balanceRepository.findByPlayerIdForUpdate("p1")).thenReturn(Optional.of(extended));

        assertThat(walletLedger.expireBonuses()).isZero();
        assertThat(extended.getBonusBalance()).isEqualByComparingTo("40");
        verify(balanceRepository, never()).save(any());
    }

    @Test
    void pointSweepLocksWalletBeforeReadingLots() {
        echoSaves();
        WalletBalanceEntity failingWallet = WalletBalanceEntity.builder().playerId("p1").build();
        WalletBalanceEntity wallet = WalletBalanceEntity.builder().playerId("p2").lpBalance(new BigDecimal("80")).build();
        PointEntryEntity lot = PointEntryEntity.builder()
                .id(5L)
                .playerId("p2")
                .amount(new BigDecimal("50"))
                .remainingAmount(new BigDecimal("50"))
                .issuedAt(Instant.now().minus(10, ChronoUnit.DAYS))
                .expiresAt(Instant.now().minus(1, ChronoUnit.DAYS))
                .build();
        when(pointEntryRepository.findPlayerIdsWithDueEntries(any(Instant.class))).thenReturn(List.of("p1", "p2"));
        when(balanceRepository.findByPlayerIdForUpdate("p1")).thenReturn(Optional.of(failingWallet));
        when(pointEntryRepository.findDueForExpiry(eq("p1"), any(Instant.class))).thenThrow(new IllegalStateException("bad row"));
        when(balanceRepository.findByPlayerIdForUpdate("p2")).thenReturn(Optional.of(wallet));
        when(pointEntryRepository.findDueForExpiry(eq("p2"), any(Instant.class))).thenReturn(List.of(lot));
        when(pointEntryRepository.save(lot)).thenReturn(lot);

        assertThat(walletLedger.processPointExpiry()).isEqualTo(1);

        assertThat(wallet.getLpBalance()).isEqualByComparingTo("30");
        assertThat(lot.isExpired()).isTrue();
        assertThat(lot.getRemainingAmount()).isEqualByComparingTo("0");
        InOrder order = inOrder(balanceRepository, pointEntryRepository);
        order.verify(balanceRepository).findByPlayerIdForUpdate("p2");
        order.verify(pointEntryRepository).findDueForExpiry(eq("p2"), any(Instant.class));
        verify(transactionRepository).save(argThat((LedgerTransactionEntity row) -> row.getTransactionType() == TransactionType.LP_EXPIRED
                && row.getAmount().compareTo(new BigDecimal("-50")) == 0));
    }
}
