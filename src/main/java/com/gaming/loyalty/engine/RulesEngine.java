package com.gaming.loyalty.engine;

import com.gaming.loyalty.common.AfterCommit;
import com.gaming.loyalty.config.LoyaltyProperties;
import com.gaming.loyalty.domain.Amounts;
import com.gaming.loyalty.domain.RewardConfig;
import com.gaming.loyalty.domain.RewardMetadata;
import com.gaming.loyalty.domain.RewardStatus;
import com.gaming.loyalty.domain.RewardType;
import com.gaming.loyalty.engine.formula.FormulaEvaluationException;
import com.gaming.loyalty.engine.formula.FormulaEvaluator;
import com.gaming.loyalty.exception.NotFoundException;
import com.gaming.loyalty.exception.StateTransitionException;
import com.gaming.loyalty.messaging.LedgerEvent;
import com.gaming.loyalty.messaging.LedgerEventPublisher;
import com.gaming.loyalty.persistence.entity.RewardRecordEntity;
import com.gaming.loyalty.persistence.entity.RewardRuleEntity;
import com.gaming.loyalty.persistence.repository.RewardRecordRepository;
import com.gaming.loyalty.persistence.repository.RewardRuleRepository;
import com.gaming.loyalty.player.PlayerState;
import com.gaming.loyalty.player.PlayerStateProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Matches reward rules against player state and turns matches into PENDING reward records.
 * Issuance and safety checks happen elsewhere; this service never touches the wallet.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RulesEngine {

    private final RewardRuleRepository ruleRepository;
    private final RewardRecordRepository rewardRepository;
    private final PlayerStateProvider playerStateProvider;
    private final ConditionEvaluator conditionEvaluator;
    private final FormulaEvaluator formulaEvaluator;
    private final LedgerEventPublisher eventPublisher;
    private final LoyaltyProperties properties;

    public boolean evaluateCondition(Map<String, Object> condition, PlayerState state) {
        return conditionEvaluator.matches(condition, state);
    }

    public boolean evaluateRule(RewardRuleEntity rule, PlayerState state) {
        if (!rule.isActive()) {
            return false;
        }
        return conditionEvaluator.matches(rule.getConditions(), state);
    }

    /**
     * Raw (uncapped) amount for a rule. A formula that is a plain number is returned as is; anything else
     * is evaluated against the state's numeric fields. Evaluation failures yield zero.
     */
    public BigDecimal calculateRewardAmount(RewardRuleEntity rule, PlayerState state) {
        RewardConfig config = rule.getRewardConfig();
        String formula = config != null && config.getFormula() != null ? config.getFormula().trim() : "0";
        BigDecimal literal = parseLiteral(formula);
        if (literal != null) {
            return literal;
        }
        try {
            return formulaEvaluator.evaluate(formula, state.numericFields());
        } catch (FormulaEvaluationException e) {
            log.error("Formula evaluation failed: ruleId={}, formula='{}', reason={}", rule.getRuleId(), formula, e.getMessage());
            return BigDecimal.ZERO;
        }
    }

    private static BigDecimal parseLiteral(String formula) {
        try {
            return new BigDecimal(formula);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Clamps to {@code max_amount} when configured. No lower bound is applied. */
    public BigDecimal applyCaps(BigDecimal amount, RewardConfig config) {
        if (config != null && config.getMaxAmount() != null && amount.compareTo(config.getMaxAmount()) > 0) {
            return config.getMaxAmount();
        }
        return amount;
    }

    /**
     * Active rules matching the player, highest priority first.
     *
     * @param state player state, or null to load it from the provider
     */
    @Transactional(readOnly = true)
    public List<RewardRuleEntity> getApplicableRules(String playerId, PlayerState state) {
        PlayerState effective = state != null ? state : playerStateProvider.getPlayerState(playerId);
        List<RewardRuleEntity> applicable = new ArrayList<>();
        for (RewardRuleEntity rule : ruleRepository.findActiveOrderByPriority()) {
            if (evaluateRule(rule, effective)) {
                log.info("Rule matches: ruleId={}, playerId={}", rule.getRuleId(), playerId);
                applicable.add(rule);
            }
        }
        return applicable;
    }

    /**
     * Persists a PENDING reward for the rule.
     *
     * @throws com.gaming.loyalty.exception.ConfigurationException if the rule names an unknown reward type
     */
    @Transactional
    public RewardRecordEntity createReward(String playerId, RewardRuleEntity rule, BigDecimal amount, PlayerState state) {
        RewardConfig config = rule.getRewardConfig() != null ? rule.getRewardConfig() : RewardConfig.builder().build();
        RewardType rewardType = config.resolveType(rule.getRuleId());
        BigDecimal multiplier = Amounts.orZero(config.getWageringRequirement());
        Instant now = Instant.now();
        Instant expiresAt = config.getExpiryHours() != null && config.getExpiryHours() > 0
                ? now.plus(config.getExpiryHours(), ChronoUnit.HOURS)
                : null;

        RewardRecordEntity reward = RewardRecordEntity.builder()
                .playerId(playerId)
                .ruleId(rule.getRuleId())
                .rewardType(rewardType)
                .currencyType(rewardType.currency())
                .amount(Amounts.normalize(amount))
                .status(RewardStatus.PENDING)
                .wageringRequired(Amounts.normalize(amount.multiply(multiplier, Amounts.CONTEXT)))
                .wageringCompleted(BigDecimal.ZERO)
                .createdAt(now)
                .expiresAt(expiresAt)
                .metadata(snapshot(rule, config, state))
                .build();
        reward = rewardRepository.save(reward);
        log.info("Created reward: rewardId={}, playerId={}, amount={}, currency={}, ruleId={}",
                reward.getId(), playerId, reward.getAmount(), reward.getCurrencyType().getCode(), rule.getRuleId());
        return reward;
    }

    @Transactional
    public List<RewardRecordEntity> evaluateAndCreateRewards(String playerId) {
        return evaluateAndCreateRewards(playerId, properties.getRules().getDefaultRewardLimit());
    }

    /**
     * Loads the player's state once, then creates rewards for at most {@code limit} of the highest-priority
     * matching rules. Rules whose capped amount is not positive are skipped.
     */
    @Transactional
    public List<RewardRecordEntity> evaluateAndCreateRewards(String playerId, int limit) {
        PlayerState state = playerStateProvider.getPlayerState(playerId);
        List<RewardRuleEntity> applicable = getApplicableRules(playerId, state);
        List<RewardRecordEntity> created = new ArrayList<>();
        for (RewardRuleEntity rule : applicable.subList(0, Math.min(Math.max(limit, 0), applicable.size()))) {
            BigDecimal amount = applyCaps(calculateRewardAmount(rule, state), rule.getRewardConfig());
            if (amount.signum() <= 0) {
                log.warn("Skipping non-positive reward amount: ruleId={}, playerId={}, amount={}", rule.getRuleId(), playerId, amount);
                continue;
            }
            created.add(createReward(playerId, rule, amount, state));
        }
        log.info("Reward evaluation finished: playerId={}, applicableRules={}, rewardsCreated={}", playerId, applicable.size(), created.size());
        return created;
    }

    /** Evaluates one rule for one player without creating anything. */
    @Transactional(readOnly = true)
    public RulePreview previewRule(String ruleId, String playerId) {
        RewardRuleEntity rule = ruleRepository.findById(ruleId)
                .orElseThrow(() -> new NotFoundException("Rule not found: " + ruleId));
        PlayerState state = playerStateProvider.getPlayerState(playerId);
        boolean matches = evaluateRule(rule, state);
        BigDecimal raw = matches ? calculateRewardAmount(rule, state) : BigDecimal.ZERO;
        return RulePreview.builder()
                .ruleId(ruleId)
                .playerId(playerId)
                .matches(matches)
                .rawAmount(raw)
                .cappedAmount(applyCaps(raw, rule.getRewardConfig()))
                .playerState(state.asMap())
                .build();
    }

    /** Withdraws a reward that has not been issued yet. */
    @Transactional
    public RewardRecordEntity cancelReward(Long rewardId) {
        RewardRecordEntity reward = rewardRepository.findByIdForUpdate(rewardId)
                .orElseThrow(() -> new NotFoundException("Reward not found: " + rewardId));
        if (!reward.getStatus().canTransitionTo(RewardStatus.CANCELLED)) {
            throw new StateTransitionException("Reward " + rewardId + " cannot be cancelled from status " + reward.getStatus());
        }
        reward.setStatus(RewardStatus.CANCELLED);
        reward.setCompletedAt(Instant.now());
        RewardRecordEntity saved = rewardRepository.save(reward);
        log.info("Cancelled reward: rewardId={}, playerId={}", rewardId, reward.getPlayerId());
        LedgerEvent event = LedgerEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(LedgerEvent.REWARD_STATUS_CHANGED)
                .playerId(saved.getPlayerId())
                .rewardId(saved.getId())
                .ruleId(saved.getRuleId())
                .rewardStatus(saved.getStatus())
                .amount(saved.getAmount())
                .currencyType(saved.getCurrencyType())
                .timestamp(Instant.now())
                .build();
        AfterCommit.run(() -> eventPublisher.publish(event));
        return saved;
    }

    private static Map<String, Object> snapshot(RewardRuleEntity rule, RewardConfig config, PlayerState state) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(RewardMetadata.RULE_NAME, rule.getName());
        metadata.put(RewardMetadata.PLAYER_SEGMENT, state.getString("segment").orElse(null));
        metadata.put(RewardMetadata.PLAYER_TIER, state.getString("tier").orElse(null));
        metadata.put(RewardMetadata.ELIGIBLE_GAMES,
                config.getEligibleGames() != null ? new ArrayList<>(config.getEligibleGames()) : new ArrayList<>());
        metadata.put(RewardMetadata.MAX_BET, config.getMaxBet());
        metadata.put(RewardMetadata.LP_EXPIRY_DAYS, config.getLpExpiryDays());
        return metadata;
    }
}
