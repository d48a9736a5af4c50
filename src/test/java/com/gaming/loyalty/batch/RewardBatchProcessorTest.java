package com.gaming.loyalty.batch;

import com.gaming.loyalty.domain.RewardType;
import com.gaming.loyalty.domain.ValidationResult;
import com.gaming.loyalty.engine.RulesEngine;
import com.gaming.loyalty.exception.NotFoundException;
import com.gaming.loyalty.persistence.entity.AbuseSignalEntity;
import com.gaming.loyalty.persistence.entity.RewardRecordEntity;
import com.gaming.loyalty.safety.AbuseScorer;
import com.gaming.loyalty.safety.ProfitSafetyGate;
import com.gaming.loyalty.wallet.WalletLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RewardBatchProcessorTest {

    @Mock private RulesEngine rulesEngine;
    @Mock private ProfitSafetyGate safetyGate;
    @Mock private WalletLedger walletLedger;
    @Mock private AbuseScorer abuseScorer;

    private RewardBatchProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new RewardBatchProcessor(rulesEngine, safetyGate, walletLedger, abuseScorer);
    }

    private static RewardRecordEntity reward(long id, String playerId) {
        return RewardRecordEntity.builder()
                .id(id)
                .playerId(playerId)
                .ruleId("rule-" + id)
                .rewardType(RewardType.BONUS_BALANCE)
                .amount(new BigDecimal("50"))
                .build();
    }

    @Test
    void approvedRewardsAreIssuedAndRejectedOnesCancelled() {
        when(rulesEngine.evaluateAndCreateRewards("p1", 1)).thenReturn(List.of(reward(1L, "p1")));
        when(rulesEngine.evaluateAndCreateRewards("p2", 1)).thenReturn(List.of(reward(2L, "p2")));
        when(safetyGate.validateReward("p1", new BigDecimal("50"), RewardType.BONUS_BALANCE, BigDecimal.ZERO))
                .thenReturn(ValidationResult.approve("All validations passed"));
        when(safetyGate.validateReward("p2", new BigDecimal("50"), RewardType.BONUS_BALANCE, BigDecimal.ZERO))
                .thenReturn(ValidationResult.reject("Daily cap exceeded: 1050.00 > 1000.00"));

        BatchProcessResult result = processor.process(List.of("p1", "p2"), BatchProcessOptions.defaults());

        assertThat(result.getPlayersProcessed()).isEqualTo(2);
        assertThat(result.getRewardsCreated()).isEqualTo(2);
        assertThat(result.getRewardsApproved()).isEqualTo(1);
        assertThat(result.getRewardsRejected()).isEqualTo(1);
        assertThat(result.getRewardsIssued()).isEqualTo(1);
        verify(walletLedger).issueReward(1L);
        verify(rulesEngine).cancelReward(2L);
        verify(walletLedger, never()).issueReward(2L);
        verifyNoInteractions(abuseScorer);
    }

    @Test
    void failingPlayerIsReportedAndOthersContinue() {
        when(rulesEngine.evaluateAndCreateRewards("ghost", 1)).thenThrow(new NotFoundException("Player not found: ghost"));
        when(rulesEngine.evaluateAndCreateRewards("p1", 1)).thenReturn(List.of(reward(1L, "p1")));

        BatchProcessResult result = processor.process(List.of("ghost", "p1"), BatchProcessOptions.builder()
                .validateWithSafetyGate(false)
                .build());

        assertThat(result.getPlayersRequested()).isEqualTo(2);
        assertThat(result.getPlayersProcessed()).isEqualTo(1);
        assertThat(result.getErrors()).containsEntry("ghost", "NotFoundException: Player not found: ghost");
        assertThat(result.getRewardsIssued()).isEqualTo(1);
        verifyNoInteractions(safetyGate);
    }

    @Test
    void createOnlyRunLeavesRewardsPending() {
        when(rulesEngine.evaluateAndCreateRewards("p1", 3)).thenReturn(List.of(reward(1L, "p1"), reward(2L, "p1")));

        BatchProcessResult result = processor.process(List.of("p1"), BatchProcessOptions.builder()
                .rewardLimit(3)
                .validateWithSafetyGate(false)
                .issueRewards(false)
                .build());

        assertThat(result.getRewardsCreated()).isEqualTo(2);
        assertThat(result.getRewardsIssued()).isZero();
        verify(walletLedger, never()).issueReward(anyLong());
    }

    @Test
    void abuseChecksRunWhenRequested() {
        when(rulesEngine.evaluateAndCreateRewards("p1", 1)).thenReturn(List.of());
        when(abuseScorer.detectAbuseSignals("p1")).thenReturn(List.of(new AbuseSignalEntity(), new AbuseSignalEntity()));

        BatchProcessResult result = processor.process(List.of("p1"), BatchProcessOptions.builder()
                .runAbuseChecks(true)
                .build());

        assertThat(result.getAbuseSignalsRaised()).isEqualTo(2);
        verify(abuseScorer).applyAbusePenalty("p1");
        verify(safetyGate, never()).validateReward(any(), any(), any(), any());
    }
}
