package com.gaming.loyalty.engine;

import com.gaming.loyalty.exception.ConfigurationException;
import com.gaming.loyalty.exception.NotFoundException;
import com.gaming.loyalty.persistence.entity.RewardRuleEntity;
import com.gaming.loyalty.persistence.repository.RewardRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Maintains reward rules. Rules are checked on save so a bad reward type never reaches evaluation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class RewardRuleService {

    private final RewardRuleRepository ruleRepository;

    public RewardRuleEntity createRule(RewardRuleEntity rule) {
        validate(rule);
        if (ruleRepository.existsById(rule.getRuleId())) {
            throw new ConfigurationException("Rule already exists: " + rule.getRuleId());
        }
        RewardRuleEntity saved = ruleRepository.save(rule);
        log.info("Created rule: ruleId={}, priority={}, active={}", saved.getRuleId(), saved.getPriority(), saved.isActive());
        return saved;
    }

    public RewardRuleEntity updateRule(String ruleId, RewardRuleEntity changes) {
        RewardRuleEntity existing = getRule(ruleId);
        existing.setName(changes.getName());
        existing.setDescription(changes.getDescription());
        existing.setPriority(changes.getPriority());
        existing.setActive(changes.isActive());
        existing.setConditions(changes.getConditions());
        existing.setRewardConfig(changes.getRewardConfig());
        validate(existing);
        log.info("Updated rule: ruleId={}", ruleId);
        return ruleRepository.save(existing);
    }

    public RewardRuleEntity deactivateRule(String ruleId) {
        RewardRuleEntity rule = getRule(ruleId);
        rule.setActive(false);
        log.info("Deactivated rule: ruleId={}", ruleId);
        return ruleRepository.save(rule);
    }

    @Transactional(readOnly = true)
    public RewardRuleEntity getRule(String ruleId) {
        return ruleRepository.findById(ruleId)
                .orElseThrow(() -> new NotFoundException("Rule not found: " + ruleId));
    }

    @Transactional(readOnly = true)
    public List<RewardRuleEntity> listRules(boolean activeOnly) {
        return activeOnly ? ruleRepository.findActiveOrderByPriority() : ruleRepository.findAllByOrderByPriorityDescCreatedAtAsc();
    }

    private static void validate(RewardRuleEntity rule) {
        if (rule.getRuleId() == null || rule.getRuleId().isBlank()) {
            throw new ConfigurationException("Rule id is required");
        }
        if (rule.getRewardConfig() == null) {
            throw new ConfigurationException("Reward config is required for rule " + rule.getRuleId());
        }
        rule.getRewardConfig().resolveType(rule.getRuleId());
        if (rule.getConditions() == null) {
            rule.setConditions(new LinkedHashMap<>());
        }
    }
}
