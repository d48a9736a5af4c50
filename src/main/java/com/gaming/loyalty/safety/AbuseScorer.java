package com.gaming.loyalty.safety;

import com.gaming.loyalty.config.LoyaltyProperties;
import com.gaming.loyalty.domain.AbuseSignalType;
import com.gaming.loyalty.domain.Amounts;
import com.gaming.loyalty.domain.PenaltyAction;
import com.gaming.loyalty.domain.RewardStatus;
import com.gaming.loyalty.domain.TransactionType;
import com.gaming.loyalty.exception.NotFoundException;
import com.gaming.loyalty.persistence.entity.AbuseSignalEntity;
import com.gaming.loyalty.persistence.entity.LedgerTransactionEntity;
import com.gaming.loyalty.persistence.entity.PlayerEntity;
import com.gaming.loyalty.persistence.repository.AbuseSignalRepository;
import com.gaming.loyalty.persistence.repository.LedgerTransactionRepository;
import com.gaming.loyalty.persistence.repository.PlayerRepository;
import com.gaming.loyalty.persistence.repository.RewardRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects bonus abuse patterns, records them as signals and turns unresolved signals into a 0-100
 * abuse score and a penalty on the player.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AbuseScorer {

    private static final int MAX_SCORE = 100;
    private static final int POINTS_PER_SEVERITY = 10;

    private final LedgerTransactionRepository transactionRepository;
    private final RewardRecordRepository rewardRepository;
    private final AbuseSignalRepository signalRepository;
    private final PlayerRepository playerRepository;
    private final LoyaltyProperties properties;

    /** Rewards issued to a player who has never deposited. */
    @Transactional(readOnly = true)
    public boolean detectBonusOnlyPlay(String playerId) {
        BigDecimal deposits = Amounts.orZero(transactionRepository.sumAmountByPlayerAndType(playerId, TransactionType.DEPOSIT));
        BigDecimal rewards = Amounts.orZero(rewardRepository.sumIssuedAmountSince(playerId, RewardStatus.issued(), Instant.EPOCH));
        if (rewards.signum() > 0 && deposits.signum() == 0) {
            log.warn("Bonus-only play detected: playerId={}, rewardsIssued={}", playerId, rewards);
            return true;
        }
        return false;
    }

    /** A withdrawal inside the window that also saw a reward issued. */
    @Transactional(readOnly = true)
    public boolean detectImmediateWithdrawal(String playerId) {
        Instant since = Instant.now().minus(properties.getAbuse().getImmediateWithdrawalWindow());
        long rewards = rewardRepository.countIssuedSince(playerId, RewardStatus.issued(), since);
        long withdrawals = transactionRepository.countByPlayerAndTypeSince(playerId, TransactionType.WITHDRAWAL, since);
        if (rewards > 0 && withdrawals > 0) {
            log.warn("Immediate withdrawal detected: playerId={}, withdrawals={}, rewards={}", playerId, withdrawals, rewards);
            return true;
        }
        return false;
    }

    /** Largest recent wager more than the configured ratio above the smallest. */
    @Transactional(readOnly = true)
    public boolean detectBetManipulation(String playerId) {
        LoyaltyProperties.Abuse abuse = properties.getAbuse();
        List<LedgerTransactionEntity> recent = transactionRepository.findRecentByPlayerAndType(
                playerId, TransactionType.WAGER, PageRequest.of(0, abuse.getBetSampleSize()));
        if (recent.size() < abuse.getMinBetsForVariance()) {
            return false;
        }
        BigDecimal min = null;
        BigDecimal max = null;
        BigDecimal sum = BigDecimal.ZERO;
        for (LedgerTransactionEntity wager : recent) {
            BigDecimal amount = wager.getAmount().abs();
            min = min == null ? amount : min.min(amount);
            max = max == null ? amount : max.max(amount);
            sum = sum.add(amount);
        }
        if (min.signum() > 0 && max.divide(min, Amounts.CONTEXT).compareTo(abuse.getBetVarianceRatio()) > 0) {
            log.warn("Bet manipulation detected: playerId={}, min={}, avg={}, max={}", playerId, min,
                    sum.divide(BigDecimal.valueOf(recent.size()), 2, RoundingMode.HALF_UP), max);
            return true;
        }
        return false;
    }

    /** Winnings above the configured multiple of the amount wagered, once enough has been wagered. */
    @Transactional(readOnly = true)
    public boolean detectAbnormalWinRate(String playerId) {
        LoyaltyProperties.Abuse abuse = properties.getAbuse();
        BigDecimal wagered = Amounts.orZero(transactionRepository.sumAmountByPlayerAndType(playerId, TransactionType.WAGER)).abs();
        if (wagered.compareTo(abuse.getMinWageredForWinRate()) < 0) {
            return false;
        }
        BigDecimal won = Amounts.orZero(transactionRepository.sumAmountByPlayerAndType(playerId, TransactionType.WIN)).abs();
        BigDecimal winRate = won.divide(wagered, Amounts.CONTEXT);
        if (winRate.compareTo(abuse.getWinRateThreshold()) > 0) {
            log.warn("Abnormal win rate detected: playerId={}, winRate={}", playerId, winRate.setScale(4, RoundingMode.HALF_UP));
            return true;
        }
        return false;
    }

    /**
     * Runs every detector and records a signal for each one that fires.
     */
    @Transactional
    public List<AbuseSignalEntity> detectAbuseSignals(String playerId) {
        List<AbuseSignalEntity> signals = new ArrayList<>();
        if (detectBonusOnlyPlay(playerId)) {
            signals.add(createAbuseSignal(playerId, AbuseSignalType.BONUS_ONLY_PLAY,
                    "Player only plays with bonus money, no real deposits", null));
        }
        if (detectImmediateWithdrawal(playerId)) {
            signals.add(createAbuseSignal(playerId, AbuseSignalType.IMMEDIATE_WITHDRAWAL,
                    "Withdrawal immediately after receiving reward", null));
        }
        if (detectBetManipulation(playerId)) {
            signals.add(createAbuseSignal(playerId, AbuseSignalType.BET_MANIPULATION,
                    "Suspicious bet size variance during wagering", null));
        }
        if (detectAbnormalWinRate(playerId)) {
            signals.add(createAbuseSignal(playerId, AbuseSignalType.ABNORMAL_WIN_RATE,
                    "Win rate significantly above expected", null));
        }
        return signals;
    }

    @Transactional
    public AbuseSignalEntity createAbuseSignal(String playerId, AbuseSignalType type, String description,
                                               Map<String, Object> metadata) {
        AbuseSignalEntity signal = signalRepository.save(AbuseSignalEntity.builder()
                .playerId(playerId)
                .signalType(type)
                .severity(type.getSeverity())
                .description(description)
                .metadata(metadata)
                .resolved(false)
                .detectedAt(Instant.now())
                .build());
        log.warn("Abuse signal created: playerId={}, type={}, severity={}", playerId, type, type.getSeverity());
        return signal;
    }

    /** Sum of unresolved signal severities times ten, capped at 100. */
    @Transactional(readOnly = true)
    public int calculateAbuseScore(String playerId) {
        int severity = signalRepository.findByPlayerIdAndResolvedFalse(playerId).stream()
                .mapToInt(AbuseSignalEntity::getSeverity)
                .sum();
        return Math.min(severity * POINTS_PER_SEVERITY, MAX_SCORE);
    }

    /**
     * Stores the current abuse score as the player's risk score and applies the matching penalty.
     *
     * @throws NotFoundException if the player does not exist
     */
    @Transactional
    public PenaltyAction applyAbusePenalty(String playerId) {
        PlayerEntity player = playerRepository.findById(playerId)
                .orElseThrow(() -> new NotFoundException("Player not found: " + playerId));
        int score = calculateAbuseScore(playerId);
        player.setRiskScore(score);
        PenaltyAction action = penaltyFor(score);
        switch (action) {
            case BLOCKED -> {
                player.setBlocked(true);
                log.warn("Player blocked: playerId={}, abuseScore={}", playerId, score);
            }
            case INCREASED_WAGERING -> log.warn("Player flagged for increased wagering: playerId={}, abuseScore={}", playerId, score);
            case REDUCED_REWARDS -> log.warn("Player flagged for reduced rewards: playerId={}, abuseScore={}", playerId, score);
            case NO_ACTION -> log.debug("No abuse penalty: playerId={}, abuseScore={}", playerId, score);
        }
        playerRepository.save(player);
        return action;
    }

    PenaltyAction penaltyFor(int score) {
        LoyaltyProperties.Abuse abuse = properties.getAbuse();
        if (score >= abuse.getBlockScore()) {
            return PenaltyAction.BLOCKED;
        }
        if (score >= abuse.getIncreasedWageringScore()) {
            return PenaltyAction.INCREASED_WAGERING;
        }
        if (score >= abuse.getReducedRewardsScore()) {
            return PenaltyAction.REDUCED_REWARDS;
        }
        return PenaltyAction.NO_ACTION;
    }

    /** Raises a maximum-severity signal for an operator to look at. */
    @Transactional
    public AbuseSignalEntity flagForReview(String playerId, String reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reason", reason);
        AbuseSignalEntity signal = createAbuseSignal(playerId, AbuseSignalType.MANUAL_REVIEW_REQUIRED,
                "Flagged for manual review: " + reason, metadata);
        log.error("Player flagged for manual review: playerId={}, reason={}", playerId, reason);
        return signal;
    }

    @Transactional
    public AbuseSignalEntity resolveSignal(Long signalId, String notes) {
        AbuseSignalEntity signal = signalRepository.findById(signalId)
                .orElseThrow(() -> new NotFoundException("Abuse signal not found: " + signalId));
        if (!signal.isResolved()) {
            signal.setResolved(true);
            signal.setResolvedAt(Instant.now());
            signal.setResolutionNotes(notes);
            signal = signalRepository.save(signal);
            log.info("Abuse signal resolved: signalId={}, playerId={}", signalId, signal.getPlayerId());
        }
        return signal;
    }
}
