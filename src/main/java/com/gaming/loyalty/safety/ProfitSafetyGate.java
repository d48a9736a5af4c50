package com.gaming.loyalty.safety;

import com.gaming.loyalty.config.LoyaltyProperties;
import com.gaming.loyalty.domain.Amounts;
import com.gaming.loyalty.domain.ExpectedValue;
import com.gaming.loyalty.domain.RewardStatus;
import com.gaming.loyalty.domain.RewardType;
import com.gaming.loyalty.domain.TransactionType;
import com.gaming.loyalty.domain.ValidationResult;
import com.gaming.loyalty.persistence.repository.LedgerTransactionRepository;
import com.gaming.loyalty.persistence.repository.RewardRecordRepository;
import com.gaming.loyalty.player.PlayerState;
import com.gaming.loyalty.player.PlayerStateProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;

/**
 * Decides whether a reward is worth granting: its expected value must be non-negative at the house edge,
 * its ROI must clear the requested minimum, and the player must stay within daily, weekly and monthly caps.
 * Outcomes are {@link ValidationResult}s; nothing here throws for a rejection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProfitSafetyGate {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LedgerTransactionRepository transactionRepository;
    private final RewardRecordRepository rewardRepository;
    private final PlayerStateProvider playerStateProvider;
    private final LoyaltyProperties properties;

    public BigDecimal getHouseEdge(String gameType) {
        LoyaltyProperties.Safety safety = properties.getSafety();
        if (gameType == null) {
            return safety.getDefaultHouseEdge();
        }
        BigDecimal edge = safety.getHouseEdges().get(gameType.toLowerCase(Locale.ROOT));
        return edge != null ? edge : safety.getDefaultHouseEdge();
    }

    public BigDecimal calculateExpectedFutureWager(String playerId) {
        return calculateExpectedFutureWager(playerId, properties.getSafety().getLookbackDays());
    }

    /**
     * Average daily wager over the lookback window, projected over the configured projection period.
     */
    public BigDecimal calculateExpectedFutureWager(String playerId, int lookbackDays) {
        if (lookbackDays <= 0) {
            return BigDecimal.ZERO;
        }
        Instant since = Instant.now().minus(lookbackDays, ChronoUnit.DAYS);
        BigDecimal wagered = Amounts.orZero(
                transactionRepository.sumAmountByPlayerAndTypeSince(playerId, TransactionType.WAGER, since)).abs();
        return wagered.multiply(BigDecimal.valueOf(properties.getSafety().getProjectionDays()))
                .divide(BigDecimal.valueOf(lookbackDays), Amounts.CONTEXT);
    }

    /** Extra play a reward type is expected to generate in a segment; 1.0 when unconfigured. */
    public BigDecimal getRetentionMultiplier(String segment, RewardType rewardType) {
        if (segment == null || rewardType == null) {
            return BigDecimal.ONE;
        }
        Map<String, BigDecimal> row = properties.getSafety().getRetentionMultipliers().get(segment.toUpperCase(Locale.ROOT));
        if (row == null) {
            return BigDecimal.ONE;
        }
        BigDecimal multiplier = row.get(rewardType.name());
        return multiplier != null ? multiplier : BigDecimal.ONE;
    }

    /**
     * @throws com.gaming.loyalty.exception.NotFoundException if the player does not exist
     */
    public ExpectedValue calculateExpectedValue(String playerId, BigDecimal rewardAmount, RewardType rewardType) {
        PlayerState state = playerStateProvider.getPlayerState(playerId);
        BigDecimal baseWager = calculateExpectedFutureWager(playerId);
        BigDecimal retention = getRetentionMultiplier(state.getString("segment").orElse(null), rewardType);
        BigDecimal expectedWager = baseWager.multiply(retention, Amounts.CONTEXT);
        BigDecimal houseEdge = getHouseEdge(null);
        BigDecimal expectedRevenue = expectedWager.multiply(houseEdge, Amounts.CONTEXT);
        BigDecimal expectedProfit = expectedRevenue.subtract(rewardAmount, Amounts.CONTEXT);
        BigDecimal roi = rewardAmount.signum() > 0
                ? expectedProfit.divide(rewardAmount, Amounts.CONTEXT).multiply(HUNDRED, Amounts.CONTEXT)
                : BigDecimal.ZERO;
        return ExpectedValue.builder()
                .baseWager(baseWager)
                .retentionMultiplier(retention)
                .expectedWager(expectedWager)
                .houseEdge(houseEdge)
                .expectedRevenue(expectedRevenue)
                .rewardCost(rewardAmount)
                .expectedProfit(expectedProfit)
                .roiPercent(roi)
                .build();
    }

    public ValidationResult validateRewardProfitability(String playerId, BigDecimal rewardAmount, RewardType rewardType,
                                                        BigDecimal minRoiPercent) {
        try {
            ExpectedValue ev = calculateExpectedValue(playerId, rewardAmount, rewardType);
            if (ev.getExpectedProfit().signum() < 0) {
                return ValidationResult.reject(String.format(Locale.ROOT, "Negative expected profit: %.2f", ev.getExpectedProfit()));
            }
            BigDecimal minRoi = Amounts.orZero(minRoiPercent);
            if (ev.getRoiPercent().compareTo(minRoi) < 0) {
                return ValidationResult.reject(String.format(Locale.ROOT, "ROI %.1f%% below minimum %s%%",
                        ev.getRoiPercent(), minRoi.toPlainString()));
            }
            log.info("Reward profitable: playerId={}, amount={}, expectedProfit={}, roiPercent={}",
                    playerId, rewardAmount, ev.getExpectedProfit(), ev.getRoiPercent());
            return ValidationResult.approve("Profitable");
        } catch (RuntimeException e) {
            log.error("Profitability validation failed: playerId={}", playerId, e);
            return ValidationResult.reject("Validation error: " + e.getMessage());
        }
    }

    /**
     * Rewards issued in the trailing window (ACTIVE, COMPLETED or EXPIRED, by issue time) plus the candidate
     * must not exceed the period cap.
     */
    public ValidationResult checkRewardCaps(String playerId, BigDecimal rewardAmount, RewardCapPeriod period) {
        BigDecimal cap = period.cap(properties.getSafety());
        Instant since = Instant.now().minus(period.getDays(), ChronoUnit.DAYS);
        BigDecimal issued = Amounts.orZero(rewardRepository.sumIssuedAmountSince(playerId, RewardStatus.issued(), since));
        BigDecimal total = issued.add(rewardAmount);
        if (total.compareTo(cap) > 0) {
            log.warn("Reward cap exceeded: playerId={}, period={}, total={}, cap={}", playerId, period, total, cap);
            return ValidationResult.reject(String.format(Locale.ROOT, "%s cap exceeded: %.2f > %.2f", period.getLabel(), total, cap));
        }
        log.debug("Reward within cap: playerId={}, period={}, issued={}, cap={}", playerId, period, issued, cap);
        return ValidationResult.approve("Within " + period.getLabel().toLowerCase(Locale.ROOT) + " cap");
    }

    public ValidationResult validateReward(String playerId, BigDecimal rewardAmount, RewardType rewardType) {
        return validateReward(playerId, rewardAmount, rewardType, BigDecimal.ZERO);
    }

    /**
     * Profitability, then daily, weekly and monthly caps. Stops at the first rejection.
     */
    public ValidationResult validateReward(String playerId, BigDecimal rewardAmount, RewardType rewardType,
                                           BigDecimal minRoiPercent) {
        ValidationResult profitability = validateRewardProfitability(playerId, rewardAmount, rewardType, minRoiPercent);
        if (!profitability.isApproved()) {
            return ValidationResult.reject("Profitability check failed: " + profitability.getReason());
        }
        for (RewardCapPeriod period : RewardCapPeriod.values()) {
            ValidationResult caps = checkRewardCaps(playerId, rewardAmount, period);
            if (!caps.isApproved()) {
                return caps;
            }
        }
        return ValidationResult.approve("All validations passed");
    }
}
