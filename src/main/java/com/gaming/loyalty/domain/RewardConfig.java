package com.gaming.loyalty.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Reward half of a rule: what to grant and how to size it. Stored as a JSON column.
 * {@code formula} is either a numeric literal or an arithmetic expression over player state fields.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RewardConfig {

    @JsonProperty("type")
    String type;

    @JsonProperty("formula")
    String formula;

    @JsonProperty("max_amount")
    BigDecimal maxAmount;

    /** Multiplier applied to the reward amount to get the wagering requirement. */
    @JsonProperty("wagering_requirement")
    BigDecimal wageringRequirement;

    @JsonProperty("expiry_hours")
    Integer expiryHours;

    @JsonProperty("eligible_games")
    List<String> eligibleGames;

    @JsonProperty("max_bet")
    BigDecimal maxBet;

    @JsonProperty("lp_expiry_days")
    Integer lpExpiryDays;

    /**
     * @throws com.gaming.loyalty.exception.ConfigurationException if {@code type} is not a known reward type
     */
    public RewardType resolveType(String ruleId) {
        return RewardType.fromConfig(type, ruleId);
    }
}
