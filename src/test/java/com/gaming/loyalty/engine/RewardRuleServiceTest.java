package com.gaming.loyalty.engine;

import com.gaming.loyalty.domain.RewardConfig;
import com.gaming.loyalty.exception.ConfigurationException;
import com.gaming.loyalty.exception.NotFoundException;
import com.gaming.loyalty.persistence.entity.RewardRuleEntity;
import com.gaming.loyalty.persistence.repository.RewardRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RewardRuleServiceTest {

    @Mock private RewardRuleRepository ruleRepository;

    private RewardRuleService service;

    @BeforeEach
    void setUp() {
        service = new RewardRuleService(ruleRepository);
    }

    private static RewardRuleEntity rule(String type) {
        return RewardRuleEntity.builder()
                .ruleId("weekend-cashback")
                .name("Weekend cashback")
                .priority(10)
                .active(true)
                .rewardConfig(RewardConfig.builder().type(type).formula("net_loss * 0.1").build())
                .build();
    }

    @Test
    void createsRuleWithEmptyConditionsByDefault() {
        when(ruleRepository.existsById("weekend-cashback")).thenReturn(false);
        when(ruleRepository.save(any(RewardRuleEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RewardRuleEntity saved = service.createRule(rule("cashback"));

        assertThat(saved.getConditions()).isEmpty();
    }

    @Test
    void rejectsUnknownRewardTypeBeforeSaving() {
        assertThatThrownBy(() -> service.createRule(rule("VIP_PERKS")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("VIP_PERKS");
        verify(ruleRepository, never()).save(any());
    }

    @Test
    void rejectsDuplicateRuleId() {
        when(ruleRepository.existsById("weekend-cashback")).thenReturn(true);

        assertThatThrownBy(() -> service.createRule(rule("CASHBACK"))).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void deactivatesExistingRule() {
        RewardRuleEntity existing = rule("CASHBACK");
        when(ruleRepository.findById("weekend-cashback")).thenReturn(Optional.of(existing));
        when(ruleRepository.save(existing)).thenReturn(existing);

        assertThat(service.deactivateRule("weekend-cashback").isActive()).isFalse();
    }

    @Test
    void missingRuleIsNotFound() {
        when(ruleRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getRule("nope")).isInstanceOf(NotFoundException.class);
    }
}
