package com.gaming.loyalty.batch;

import com.gaming.loyalty.wallet.WalletLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically forfeits expired bonus balances and expires point lots.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "loyalty.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class ExpirySweepScheduler {

    private final WalletLedger walletLedger;

    @Scheduled(cron = "${loyalty.sweep.cron:0 0 * * * *}")
    public void runExpirySweeps() {
        try {
            int bonuses = walletLedger.expireBonuses();
            log.debug("Bonus expiry sweep: expired={}", bonuses);
        } catch (RuntimeException e) {
            log.error("Bonus expiry sweep failed", e);
        }
        try {
            int entries = walletLedger.processPointExpiry();
            log.debug("Point expiry sweep: entriesExpired={}", entries);
        } catch (RuntimeException e) {
            log.error("Point expiry sweep failed", e);
        }
    }
}
