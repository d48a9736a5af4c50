package com.gaming.loyalty;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the loyalty reward engine. Provides:
 * <ul>
 *   <li>Rule evaluation and reward issuance</li>
 *   <li>Multi-currency wallet ledger with FIFO loyalty point expiry</li>
 *   <li>Profit-safety gate and abuse scoring</li>
 *   <li>Kafka ledger events and scheduled expiry sweeps</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class LoyaltyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoyaltyEngineApplication.class, args);
    }
}
