package com.gaming.loyalty.batch;

import com.gaming.loyalty.domain.ValidationResult;
import com.gaming.loyalty.engine.RulesEngine;
import com.gaming.loyalty.persistence.entity.RewardRecordEntity;
import com.gaming.loyalty.safety.AbuseScorer;
import com.gaming.loyalty.safety.ProfitSafetyGate;
import com.gaming.loyalty.wallet.WalletLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the reward pipeline for a list of players: evaluate rules, gate each reward through the safety
 * checks, issue what passes. Each step commits on its own, so one player's failure leaves the others
 * untouched; a reward whose issuance fails stays PENDING and can be issued later.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewardBatchProcessor {

    private final RulesEngine rulesEngine;
    private final ProfitSafetyGate safetyGate;
    private final WalletLedger walletLedger;
    private final AbuseScorer abuseScorer;

    public BatchProcessResult process(List<String> playerIds, BatchProcessOptions options) {
        Counters counters = new Counters();
        Map<String, String> errors = new LinkedHashMap<>();
        for (String playerId : playerIds) {
            try {
                processPlayer(playerId, options, counters);
                counters.players++;
            } catch (RuntimeException e) {
                log.error("Batch processing failed for player: playerId={}", playerId, e);
                errors.put(playerId, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        BatchProcessResult result = BatchProcessResult.builder()
                .playersRequested(playerIds.size())
                .playersProcessed(counters.players)
                .rewardsCreated(counters.created)
                .rewardsApproved(counters.approved)
                .rewardsRejected(counters.rejected)
                .rewardsIssued(counters.issued)
                .abuseSignalsRaised(counters.signals)
                .errors(errors)
                .build();
        log.info("Batch finished: requested={}, processed={}, created={}, issued={}, rejected={}, failed={}",
                result.getPlayersRequested(), result.getPlayersProcessed(), result.getRewardsCreated(),
                result.getRewardsIssued(), result.getRewardsRejected(), errors.size());
        return result;
    }

    private void processPlayer(String playerId, BatchProcessOptions options, Counters counters) {
        List<RewardRecordEntity> rewards = rulesEngine.evaluateAndCreateRewards(playerId, options.getRewardLimit());
        counters.created += rewards.size();
        for (RewardRecordEntity reward : rewards) {
            if (options.isValidateWithSafetyGate()) {
                ValidationResult validation = safetyGate.validateReward(
                        playerId, reward.getAmount(), reward.getRewardType(), options.getMinRoiPercent());
                if (!validation.isApproved()) {
                    log.warn("Reward rejected by safety gate: rewardId={}, playerId={}, reason={}",
                            reward.getId(), playerId, validation.getReason());
                    rulesEngine.cancelReward(reward.getId());
                    counters.rejected++;
                    continue;
                }
                counters.approved++;
            }
            if (options.isIssueRewards()) {
                walletLedger.issueReward(reward.getId());
                counters.issued++;
            }
        }
        if (options.isRunAbuseChecks()) {
            counters.signals += abuseScorer.detectAbuseSignals(playerId).size();
            abuseScorer.applyAbusePenalty(playerId);
        }
    }

    private static final class Counters {
        int players;
        int created;
        int approved;
        int rejected;
        int issued;
        int signals;
    }
}
