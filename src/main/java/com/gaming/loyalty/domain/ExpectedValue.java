package com.gaming.loyalty.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Expected-value breakdown of granting a reward: projected extra wager, revenue at the house edge,
 * and profit net of the reward cost.
 */
@Value
@Builder
public class ExpectedValue {
    BigDecimal baseWager;
    BigDecimal retentionMultiplier;
    BigDecimal expectedWager;
    BigDecimal houseEdge;
    BigDecimal expectedRevenue;
    BigDecimal rewardCost;
    BigDecimal expectedProfit;
    BigDecimal roiPercent;
}
