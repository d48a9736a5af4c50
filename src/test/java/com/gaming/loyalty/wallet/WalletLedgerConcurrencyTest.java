package com.gaming.loyalty.wallet;

import com.gaming.loyalty.domain.CurrencyType;
import com.gaming.loyalty.domain.RewardStatus;
import com.gaming.loyalty.domain.RewardType;
import com.gaming.loyalty.exception.StateTransitionException;
import com.gaming.loyalty.persistence.entity.PointEntryEntity;
import com.gaming.loyalty.persistence.entity.RewardRecordEntity;
import com.gaming.loyalty.persistence.repository.LedgerTransactionRepository;
import com.gaming.loyalty.persistence.repository.PointEntryRepository;
import com.gaming.loyalty.persistence.repository.RewardRecordRepository;
import com.gaming.loyalty.persistence.repository.WalletBalanceRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Two threads against the same player. Every ledger call commits, so each test works on fresh player ids.
 */
@SpringBootTest
class WalletLedgerConcurrencyTest {

    @Autowired private WalletLedger walletLedger;
    @Autowired private WalletBalanceRepository balanceRepository;
    @Autowired private PointEntryRepository pointEntryRepository;
    @Autowired private LedgerTransactionRepository transactionRepository;
    @Autowired private RewardRecordRepository rewardRepository;
    @Autowired private PlatformTransactionManager transactionManager;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
    }

    private static String newPlayer(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    /** Releases both tasks at once and returns the failure of each, or null when it succeeded. */
    private List<Throwable> runTogether(Callable<?> first, Callable<?> second) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (Callable<?> task : List.of(first, second)) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        List<Throwable> failures = new ArrayList<>();
        for (Future<?> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
                failures.add(null);
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            } catch (TimeoutException e) {
                failures.add(e);
            }
        }
        return failures;
    }

    private BigDecimal lpBalance(String player) {
        return balanceRepository.findByPlayerId(player).orElseThrow().getLpBalance();
    }

    @Test
    void simultaneousFirstCreditsBothLand() throws InterruptedException {
        for (int round = 0; round < 10; round++) {
            String player = newPlayer("first-credit");

            List<Throwable> failures = runTogether(
                    () -> walletLedger.addLoyaltyPoints(player, new BigDecimal("10"), "ACTION", null),
                    () -> walletLedger.addLoyaltyPoints(player, new BigDecimal("15"), "ACTION", null));

            assertThat(failures).containsOnlyNulls();
            assertThat(lpBalance(player)).isEqualByComparingTo("25");
            assertThat(pointEntryRepository.sumRemainingByPlayer(player)).isEqualByComparingTo("25");
            assertThat(balanceRepository.findAll()).filteredOn(w -> w.getPlayerId().equals(player)).hasSize(1);
        }
    }

    @Test
    void simultaneousIssueCreditsOnce() throws InterruptedException {
        String player = newPlayer("issue");
        RewardRecordEntity reward = rewardRepository.save(RewardRecordEntity.builder()
                .playerId(player)
                .ruleId("weekly-points")
                .rewardType(RewardType.LOYALTY_POINTS)
                .currencyType(CurrencyType.LOYALTY_POINTS)
                .amount(new BigDecimal("75"))
                .status(RewardStatus.PENDING)
                .build());

        List<Throwable> failures = runTogether(
                () -> walletLedger.issueReward(reward.getId()),
                () -> walletLedger.issueReward(reward.getId()));

        assertThat(failures).filteredOn(f -> f == null).hasSize(1);
        assertThat(failures).filteredOn(f -> f != null).singleElement().isInstanceOf(StateTransitionException.class);
        assertThat(lpBalance(player)).isEqualByComparingTo("75");
        assertThat(transactionRepository.findByReferenceId(String.valueOf(reward.getId()))).hasSize(1);
        assertThat(rewardRepository.findById(reward.getId()).orElseThrow().getStatus()).isEqualTo(RewardStatus.ACTIVE);
    }

    @Test
    void expirySweepWaitsForInFlightDebit() throws Exception {
        String player = newPlayer("sweep-vs-debit");
        walletLedger.addLoyaltyPoints(player, new BigDecimal("100"), "ACTION", null);
        PointEntryEntity oldest = pointEntryRepository.findByPlayerIdOrderByIssuedAtAscIdAsc(player).get(0);
        oldest.setExpiresAt(Instant.now().minus(1, ChronoUnit.DAYS));
        pointEntryRepository.save(oldest);
        walletLedger.addLoyaltyPoints(player, new BigDecimal("50"), "ACTION", null);

        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        CountDownLatch debited = new CountDownLatch(1);
        Future<?> debit = executor.submit(() -> transaction.executeWithoutResult(status -> {
            walletLedger.deductBalance(player, CurrencyType.LOYALTY_POINTS, new BigDecimal("100"), "spend", null);
            debited.countDown();
            // Keep the wallet locked while the sweep starts
            pause(500);
        }));
        assertThat(debited.await(30, TimeUnit.SECONDS)).isTrue();
        Future<Integer> sweep = executor.submit(() -> walletLedger.processPointExpiry());

        debit.get(30, TimeUnit.SECONDS);
        sweep.get(30, TimeUnit.SECONDS);

        assertThat(lpBalance(player)).isEqualByComparingTo("50");
        assertThat(pointEntryRepository.sumRemainingByPlayer(player)).isEqualByComparingTo("50");
        assertThat(transactionRepository.findByReferenceId("point-entry:" + oldest.getId())).isEmpty();
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
