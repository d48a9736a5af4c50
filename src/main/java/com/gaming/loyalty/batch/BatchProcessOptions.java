package com.gaming.loyalty.batch;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class BatchProcessOptions {

    /** Rules applied per player, highest priority first. */
    @Builder.Default
    int rewardLimit = 1;

    /** Rewards the safety gate rejects are cancelled instead of issued. */
    @Builder.Default
    boolean validateWithSafetyGate = true;

    @Builder.Default
    BigDecimal minRoiPercent = BigDecimal.ZERO;

    @Builder.Default
    boolean issueRewards = true;

    @Builder.Default
    boolean runAbuseChecks = false;

    public static BatchProcessOptions defaults() {
        return BatchProcessOptions.builder().build();
    }
}
