package com.gaming.loyalty.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every tunable threshold of the loyalty engine, bound from {@code loyalty.*}.
 * Defaults match the production settings.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "loyalty")
public class LoyaltyProperties {

    @Valid
    private Safety safety = new Safety();

    @Valid
    private Abuse abuse = new Abuse();

    @Valid
    private Wallet wallet = new Wallet();

    @Valid
    private Tiers tiers = new Tiers();

    @Valid
    private Rules rules = new Rules();

    @Valid
    private Sweep sweep = new Sweep();

    @Valid
    private Kafka kafka = new Kafka();

    @Data
    public static class Safety {
        // Used for game types without an explicit edge
        @NotNull
        @DecimalMin("0")
        private BigDecimal defaultHouseEdge = new BigDecimal("0.05");

        private Map<String, BigDecimal> houseEdges = defaultHouseEdges();

        @NotNull
        private BigDecimal dailyCap = new BigDecimal("1000");

        @NotNull
        private BigDecimal weeklyCap = new BigDecimal("5000");

        @NotNull
        private BigDecimal monthlyCap = new BigDecimal("20000");

        // Wager history window feeding the future-wager projection
        @Min(1)
        private int lookbackDays = 30;

        @Min(1)
        private int projectionDays = 30;

        // segment -> reward type -> multiplier; anything missing is 1.0
        private Map<String, Map<String, BigDecimal>> retentionMultipliers = defaultRetentionMultipliers();

        private static Map<String, BigDecimal> defaultHouseEdges() {
            Map<String, BigDecimal> edges = new LinkedHashMap<>();
            edges.put("slots", new BigDecimal("0.05"));
            edges.put("roulette", new BigDecimal("0.027"));
            edges.put("blackjack", new BigDecimal("0.005"));
            edges.put("poker", new BigDecimal("0.05"));
            return edges;
        }

        private static Map<String, Map<String, BigDecimal>> defaultRetentionMultipliers() {
            Map<String, Map<String, BigDecimal>> table = new LinkedHashMap<>();
            table.put("LOSING", multipliers("1.8", "1.5", "1.2"));
            table.put("BREAKEVEN", multipliers("1.5", "1.4", "1.3"));
            table.put("WINNING", multipliers("1.1", "1.1", "1.2"));
            table.put("NEW", multipliers("2.0", "1.6", "1.4"));
            table.put("VIP", multipliers("1.3", "1.4", "1.5"));
            return table;
        }

        private static Map<String, BigDecimal> multipliers(String bonusBalance, String cashback, String loyaltyPoints) {
            Map<String, BigDecimal> row = new LinkedHashMap<>();
            row.put("BONUS_BALANCE", new BigDecimal(bonusBalance));
            row.put("CASHBACK", new BigDecimal(cashback));
            row.put("LOYALTY_POINTS", new BigDecimal(loyaltyPoints));
            return row;
        }
    }

    @Data
    public static class Abuse {
        private Duration immediateWithdrawalWindow = Duration.ofHours(24);

        @Min(1)
        private int betSampleSize = 20;

        @Min(2)
        private int minBetsForVariance = 10;

        @NotNull
        private BigDecimal betVarianceRatio = new BigDecimal("10");

        @NotNull
        private BigDecimal winRateThreshold = new BigDecimal("1.2");

        @NotNull
        private BigDecimal minWageredForWinRate = new BigDecimal("1000");

        // Penalty bands, inclusive lower bounds
        @Min(0)
        @Max(100)
        private int blockScore = 81;

        @Min(0)
        @Max(100)
        private int increasedWageringScore = 61;

        @Min(0)
        @Max(100)
        private int reducedRewardsScore = 31;
    }

    @Data
    public static class Wallet {
        // Null means loyalty points never expire unless the issuer says so
        @Min(1)
        private Integer defaultPointExpiryDays;

        @Min(1)
        private int redemptionLimitWindowDays = 30;
    }

    @Data
    public static class Tiers {
        @NotNull
        private BigDecimal silverLp = new BigDecimal("1000");

        @NotNull
        private BigDecimal goldLp = new BigDecimal("10000");

        @NotNull
        private BigDecimal platinumLp = new BigDecimal("50000");

        @NotNull
        private BigDecimal diamondLp = new BigDecimal("250000");
    }

    @Data
    public static class Rules {
        @Min(1)
        private int defaultRewardLimit = 1;
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;

        @NotBlank
        private String cron = "0 0 * * * *";
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;

        @NotBlank
        private String ledgerTopic = "loyalty-ledger-events";
    }
}
