package com.gaming.loyalty.wallet;

import com.gaming.loyalty.common.AfterCommit;
import com.gaming.loyalty.config.LoyaltyProperties;
import com.gaming.loyalty.domain.Amounts;
import com.gaming.loyalty.domain.CurrencyType;
import com.gaming.loyalty.domain.RewardMetadata;
import com.gaming.loyalty.domain.RewardStatus;
import com.gaming.loyalty.domain.TierLevel;
import com.gaming.loyalty.domain.TransactionType;
import com.gaming.loyalty.exception.InsufficientBalanceException;
import com.gaming.loyalty.exception.NotFoundException;
import com.gaming.loyalty.exception.RedemptionLimitExceededException;
import com.gaming.loyalty.exception.RuleInactiveException;
import com.gaming.loyalty.exception.StateTransitionException;
import com.gaming.loyalty.exception.TierRequirementNotMetException;
import com.gaming.loyalty.messaging.LedgerEvent;
import com.gaming.loyalty.messaging.LedgerEventPublisher;
import com.gaming.loyalty.persistence.entity.LedgerTransactionEntity;
import com.gaming.loyalty.persistence.entity.LoyaltyRedemptionEntity;
import com.gaming.loyalty.persistence.entity.PointEntryEntity;
import com.gaming.loyalty.persistence.entity.RedemptionRuleEntity;
import com.gaming.loyalty.persistence.entity.RewardRecordEntity;
import com.gaming.loyalty.persistence.entity.WalletBalanceEntity;
import com.gaming.loyalty.persistence.repository.LedgerTransactionRepository;
import com.gaming.loyalty.persistence.repository.LoyaltyRedemptionRepository;
import com.gaming.loyalty.persistence.repository.PointEntryRepository;
import com.gaming.loyalty.persistence.repository.RedemptionRuleRepository;
import com.gaming.loyalty.persistence.repository.RewardRecordRepository;
import com.gaming.loyalty.persistence.repository.WalletBalanceRepository;
import com.gaming.loyalty.player.PlayerStateProvider;
import com.gaming.loyalty.player.TierUpdateHook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Multi-currency wallet ledger. Every balance change appends a ledger row in the same transaction and
 * runs under a row lock on the player's wallet, so mutations of one player are serialized while different
 * players proceed in parallel. Loyalty points are additionally tracked as FIFO lots whose remaining amounts
 * always sum to the LP balance; lots are only read for mutation while their owner's wallet is locked.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletLedger {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final WalletBalanceRepository balanceRepository;
    private final PointEntryRepository pointEntryRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final RewardRecordRepository rewardRepository;
    private final RedemptionRuleRepository redemptionRuleRepository;
    private final LoyaltyRedemptionRepository redemptionRepository;
    private final PlayerStateProvider playerStateProvider;
    private final TierUpdateHook tierUpdateHook;
    private final LedgerEventPublisher eventPublisher;
    private final LoyaltyProperties properties;
    private final TransactionTemplate requiresNewTransactionTemplate;

    @Transactional
    public WalletBalanceEntity getOrCreateBalance(String playerId) {
        return balanceRepository.findByPlayerId(playerId).orElseGet(() -> {
            ensureBalanceExists(playerId);
            return balanceRepository.findByPlayerId(playerId)
                    .orElseThrow(() -> new IllegalStateException("Wallet missing after create: playerId=" + playerId));
        });
    }

    /**
     * Appends a ledger row. Pure audit: balances are not touched here.
     */
    @Transactional
    public LedgerTransactionEntity createTransaction(String playerId, TransactionType type, CurrencyType currency,
                                                     BigDecimal amount, BigDecimal balanceBefore, BigDecimal balanceAfter,
                                                     String description, String referenceId, Map<String, Object> metadata) {
        LedgerTransactionEntity transaction = transactionRepository.save(LedgerTransactionEntity.builder()
                .playerId(playerId)
                .transactionType(type)
                .currencyType(currency)
                .amount(amount)
                .balanceBefore(balanceBefore)
                .balanceAfter(balanceAfter)
                .description(description)
                .referenceId(referenceId)
                .metadata(metadata)
                .createdAt(Instant.now())
                .build());
        LedgerEvent event = LedgerEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(LedgerEvent.TRANSACTION_RECORDED)
                .playerId(playerId)
                .transactionId(transaction.getId())
                .transactionType(type)
                .currencyType(currency)
                .amount(amount)
                .balanceBefore(balanceBefore)
                .balanceAfter(balanceAfter)
                .referenceId(referenceId)
                .timestamp(transaction.getCreatedAt())
                .build();
        AfterCommit.run(() -> eventPublisher.publish(event));
        return transaction;
    }

    /**
     * Journals real-money activity (deposit, withdrawal, wager, win) as a CASH row. Wagers also advance
     * bonus wagering progress.
     */
    @Transactional
    public LedgerTransactionEntity journalActivity(String playerId, TransactionType type, BigDecimal amount, String gameType) {
        if (!type.isPlayerActivity()) {
            throw new IllegalArgumentException("Not a player activity type: " + type);
        }
        requirePositive(amount);
        BigDecimal signed = type == TransactionType.WITHDRAWAL || type == TransactionType.WAGER ? amount.negate() : amount;
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (gameType != null) {
            metadata.put("game_type", gameType);
        }
        LedgerTransactionEntity transaction = createTransaction(playerId, type, CurrencyType.CASH, signed,
                BigDecimal.ZERO, BigDecimal.ZERO, type.name().toLowerCase(Locale.ROOT), null, metadata);
        if (type == TransactionType.WAGER) {
            recordWager(playerId, amount, gameType);
        }
        return transaction;
    }

    @Transactional
    public LedgerTransactionEntity addLoyaltyPoints(String playerId, BigDecimal amount, String source, Integer expiryDays) {
        return creditLoyaltyPoints(playerId, amount, source, null, expiryDays, null);
    }

    /**
     * Credits bonus balance. The wagering requirement accumulates; expiry, max bet and eligible games
     * replace the current values only when supplied.
     */
    @Transactional
    public LedgerTransactionEntity addBonusBalance(String playerId, BonusCredit credit) {
        requirePositive(credit.getAmount());
        BigDecimal wagering = Amounts.orZero(credit.getWageringRequirement());
        if (wagering.signum() < 0) {
            throw new IllegalArgumentException("Wagering requirement must not be negative: " + wagering);
        }
        WalletBalanceEntity balance = lockBalance(playerId);
        BigDecimal before = balance.getBonusBalance();
        BigDecimal after = before.add(credit.getAmount());
        balance.setBonusBalance(after);
        balance.setBonusWageringRequired(balance.getBonusWageringRequired().add(wagering));
        if (credit.getExpiry() != null) {
            balance.setBonusExpiry(credit.getExpiry());
        }
        if (credit.getMaxBet() != null) {
            balance.setBonusMaxBet(credit.getMaxBet());
        }
        if (credit.getEligibleGames() != null && !credit.getEligibleGames().isEmpty()) {
            balance.setBonusEligibleGames(new ArrayList<>(credit.getEligibleGames()));
        }
        balanceRepository.save(balance);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("wagering_required", wagering);
        metadata.put("expiry", credit.getExpiry() != null ? credit.getExpiry().toString() : null);
        metadata.put("max_bet", credit.getMaxBet());
        metadata.put("eligible_games", credit.getEligibleGames() != null ? credit.getEligibleGames() : List.of());
        LedgerTransactionEntity transaction = createTransaction(playerId, TransactionType.BONUS_ISSUED, CurrencyType.BONUS_BALANCE,
                credit.getAmount(), before, after,
                credit.getDescription() != null ? credit.getDescription() : "Bonus balance credited",
                credit.getReferenceId(), metadata);
        log.info("Bonus credited: playerId={}, amount={}, wageringRequired={}, balanceAfter={}",
                playerId, credit.getAmount(), wagering, after);
        return transaction;
    }

    /**
     * Debits one wallet currency. Nothing is debited when the balance is short. LP debits consume
     * point lots oldest first.
     *
     * @throws InsufficientBalanceException if the balance is below {@code amount}
     */
    @Transactional
    public LedgerTransactionEntity deductBalance(String playerId, CurrencyType currency, BigDecimal amount,
                                                 String description, String referenceId) {
        requirePositive(amount);
        requireWalletCurrency(currency);
        WalletBalanceEntity balance = lockBalance(playerId);
        BigDecimal before = balance.getBalance(currency);
        if (before.compareTo(amount) < 0) {
            log.warn("Insufficient balance: playerId={}, currency={}, requested={}, available={}",
                    playerId, currency.getCode(), amount, before);
            throw new InsufficientBalanceException(playerId, currency, amount, before);
        }
        BigDecimal after = before.subtract(amount);
        balance.setBalance(currency, after);
        balanceRepository.save(balance);
        LedgerTransactionEntity transaction = createTransaction(playerId, debitType(currency), currency, amount.negate(),
                before, after, description, referenceId, null);
        if (currency == CurrencyType.LOYALTY_POINTS) {
            deductLpFifo(playerId, amount);
        }
        log.info("Balance debited: playerId={}, currency={}, amount={}, balanceAfter={}", playerId, currency.getCode(), amount, after);
        return transaction;
    }

    /**
     * Consumes {@code amount} from the player's point lots, oldest first. Only the lots change; the
     * LP balance is debited by the caller.
     */
    @Transactional
    public void deductLpFifo(String playerId, BigDecimal amount) {
        BigDecimal remaining = amount;
        List<PointEntryEntity> touched = new ArrayList<>();
        for (PointEntryEntity entry : pointEntryRepository.findConsumableEntries(playerId)) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal taken = entry.getRemainingAmount().min(remaining);
            entry.setRemainingAmount(entry.getRemainingAmount().subtract(taken));
            remaining = remaining.subtract(taken);
            touched.add(entry);
        }
        pointEntryRepository.saveAll(touched);
        if (remaining.signum() > 0) {
            log.error("Point lots short of LP debit: playerId={}, uncovered={}", playerId, remaining);
        }
        verifyPointReconciliation(playerId);
    }

    /**
     * Counts a wager toward the outstanding bonus wagering requirement.
     *
     * @return progress in percent, or empty when no requirement is outstanding or the game is not eligible
     */
    @Transactional
    public Optional<BigDecimal> recordWager(String playerId, BigDecimal amount, String gameType) {
        requirePositive(amount);
        WalletBalanceEntity balance = lockBalance(playerId);
        BigDecimal required = balance.getBonusWageringRequired();
        if (required.signum() <= 0) {
            return Optional.empty();
        }
        List<String> eligibleGames = balance.getBonusEligibleGames();
        if (gameType != null && eligibleGames != null && !eligibleGames.isEmpty() && !eligibleGames.contains(gameType)) {
            log.warn("Wager does not count toward bonus wagering: playerId={}, gameType={}, eligibleGames={}",
                    playerId, gameType, eligibleGames);
            return Optional.empty();
        }
        if (balance.getBonusMaxBet() != null && amount.compareTo(balance.getBonusMaxBet()) > 0) {
            log.warn("Wager exceeds bonus max bet: playerId={}, amount={}, maxBet={}", playerId, amount, balance.getBonusMaxBet());
        }
        BigDecimal completed = balance.getBonusWageringCompleted().add(amount);
        BigDecimal progress;
        if (completed.compareTo(required) >= 0) {
            log.info("Bonus wagering requirement completed: playerId={}, required={}", playerId, required);
            balance.setBonusWageringRequired(BigDecimal.ZERO);
            balance.setBonusWageringCompleted(BigDecimal.ZERO);
            progress = HUNDRED;
            completeBonusRewards(playerId);
        } else {
            balance.setBonusWageringCompleted(completed);
            progress = completed.multiply(HUNDRED).divide(required, 2, RoundingMode.HALF_UP);
        }
        balanceRepository.save(balance);
        return Optional.of(progress);
    }

    /**
     * Forfeits every bonus balance whose expiry has passed. Each player is handled in its own transaction;
     * a failing player is logged and skipped. Running it again finds nothing to do.
     *
     * @return number of wallets whose bonus expired
     */
    public int expireBonuses() {
        Instant now = Instant.now();
        List<String> candidates = balanceRepository.findPlayerIdsWithExpiredBonus(now);
        int expired = 0;
        int failed = 0;
        for (String playerId : candidates) {
            try {
                if (Boolean.TRUE.equals(requiresNewTransactionTemplate.execute(status -> expireBonus(playerId, now)))) {
                    expired++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Bonus expiry failed for player: playerId={}", playerId, e);
            }
        }
        if (!candidates.isEmpty()) {
            log.info("Bonus expiry sweep finished: candidates={}, expired={}, failed={}", candidates.size(), expired, failed);
        }
        return expired;
    }

    /**
     * Expires point lots past their expiry date, debiting each lot's remaining amount from the LP balance.
     * Each player is handled in its own transaction, with the lots re-read under the wallet lock.
     *
     * @return number of lots expired
     */
    public int processPointExpiry() {
        Instant now = Instant.now();
        List<String> candidates = pointEntryRepository.findPlayerIdsWithDueEntries(now);
        int expired = 0;
        int failed = 0;
        for (String playerId : candidates) {
            try {
                Integer entries = requiresNewTransactionTemplate.execute(status -> expirePointEntries(playerId, now));
                expired += entries != null ? entries : 0;
            } catch (RuntimeException e) {
                failed++;
                log.error("Point expiry failed for player: playerId={}", playerId, e);
            }
        }
        if (!candidates.isEmpty()) {
            log.info("Point expiry sweep finished: players={}, entriesExpired={}, failed={}", candidates.size(), expired, failed);
        }
        return expired;
    }

    /**
     * Converts loyalty points into cash or bonus value under a redemption rule.
     *
     * @throws NotFoundException                 if the rule does not exist
     * @throws RuleInactiveException             if the rule is deactivated
     * @throws TierRequirementNotMetException    if the player's tier is too low
     * @throws RedemptionLimitExceededException  if the monthly allowance is used up
     * @throws InsufficientBalanceException      if the LP balance is below the rule's cost or minimum
     */
    @Transactional
    public LoyaltyRedemptionEntity redeemPoints(String playerId, Long redemptionRuleId) {
        RedemptionRuleEntity rule = redemptionRuleRepository.findById(redemptionRuleId)
                .orElseThrow(() -> new NotFoundException("Redemption rule not found: " + redemptionRuleId));
        if (!rule.isActive()) {
            throw new RuleInactiveException("Redemption rule is inactive: " + redemptionRuleId);
        }
        if (rule.getTierRequirement() != null) {
            TierLevel tier = currentTier(playerId);
            if (!tier.meets(rule.getTierRequirement())) {
                throw new TierRequirementNotMetException("Redemption rule " + redemptionRuleId + " requires tier "
                        + rule.getTierRequirement() + ", player " + playerId + " is " + tier);
            }
        }
        if (rule.getMaxRedemptionsPerMonth() != null) {
            Instant since = Instant.now().minus(properties.getWallet().getRedemptionLimitWindowDays(), ChronoUnit.DAYS);
            long used = redemptionRepository.countByPlayerAndRuleSince(playerId, redemptionRuleId, since);
            if (used >= rule.getMaxRedemptionsPerMonth()) {
                throw new RedemptionLimitExceededException("Player " + playerId + " reached the limit of "
                        + rule.getMaxRedemptionsPerMonth() + " redemptions for rule " + redemptionRuleId);
            }
        }

        WalletBalanceEntity balance = lockBalance(playerId);
        BigDecimal required = rule.getLpCost().max(Amounts.orZero(rule.getMinLpBalance()));
        if (balance.getLpBalance().compareTo(required) < 0) {
            throw new InsufficientBalanceException(playerId, CurrencyType.LOYALTY_POINTS, required, balance.getLpBalance());
        }

        String reference = "redemption-rule:" + redemptionRuleId;
        deductBalance(playerId, CurrencyType.LOYALTY_POINTS, rule.getLpCost(), "Redeemed: " + rule.getName(), reference);
        CurrencyType received = switch (rule.getTargetBalance()) {
            case CASH -> {
                createTransaction(playerId, TransactionType.CASH_REDEMPTION, CurrencyType.CASH, rule.getCurrencyValue(),
                        BigDecimal.ZERO, BigDecimal.ZERO, "Cash from LP redemption: " + rule.getName(), reference, null);
                yield CurrencyType.CASH;
            }
            case BONUS -> {
                addBonusBalance(playerId, BonusCredit.builder()
                        .amount(rule.getCurrencyValue())
                        .referenceId(reference)
                        .description("Bonus from LP redemption: " + rule.getName())
                        .build());
                yield CurrencyType.BONUS_BALANCE;
            }
        };

        LoyaltyRedemptionEntity redemption = redemptionRepository.save(LoyaltyRedemptionEntity.builder()
                .playerId(playerId)
                .redemptionRuleId(redemptionRuleId)
                .lpSpent(rule.getLpCost())
                .valueReceived(rule.getCurrencyValue())
                .currencyType(received)
                .status("COMPLETED")
                .build());
        log.info("Points redeemed: playerId={}, ruleId={}, lpSpent={}, value={} {}",
                playerId, redemptionRuleId, rule.getLpCost(), rule.getCurrencyValue(), received.getCode());
        return redemption;
    }

    /**
     * Credits a PENDING reward to the wallet and marks it ACTIVE in the same transaction.
     *
     * @throws NotFoundException                  if the reward does not exist
     * @throws StateTransitionException           if the reward is not PENDING
     * @throws UnsupportedOperationException      for currencies without an issuance path (RP, tickets)
     */
    @Transactional
    public LedgerTransactionEntity issueReward(Long rewardId) {
        RewardRecordEntity reward = rewardRepository.findByIdForUpdate(rewardId)
                .orElseThrow(() -> new NotFoundException("Reward not found: " + rewardId));
        if (!reward.getStatus().canTransitionTo(RewardStatus.ACTIVE)) {
            throw new StateTransitionException("Reward " + rewardId + " is " + reward.getStatus() + ", only PENDING rewards can be issued");
        }
        String reference = String.valueOf(rewardId);
        String description = "Reward from rule " + reward.getRuleId();
        LedgerTransactionEntity transaction = switch (reward.getCurrencyType()) {
            case LOYALTY_POINTS -> creditLoyaltyPoints(reward.getPlayerId(), reward.getAmount(), "REWARD", reference,
                    RewardMetadata.lpExpiryDays(reward.getMetadata()), description);
            case BONUS_BALANCE -> addBonusBalance(reward.getPlayerId(), BonusCredit.builder()
                    .amount(reward.getAmount())
                    .wageringRequirement(reward.getWageringRequired())
                    .expiry(reward.getExpiresAt())
                    .maxBet(RewardMetadata.maxBet(reward.getMetadata()))
                    .eligibleGames(RewardMetadata.eligibleGames(reward.getMetadata()))
                    .referenceId(reference)
                    .description(description)
                    .build());
            case REWARD_POINTS, TICKETS, CASH -> throw new UnsupportedOperationException(
                    "Issuing " + reward.getCurrencyType() + " rewards is not supported: rewardId=" + rewardId);
        };
        reward.setStatus(RewardStatus.ACTIVE);
        reward.setIssuedAt(Instant.now());
        rewardRepository.save(reward);
        publishStatusChange(reward);
        log.info("Issued reward: rewardId={}, playerId={}, amount={}, currency={}, transactionId={}",
                rewardId, reward.getPlayerId(), reward.getAmount(), reward.getCurrencyType().getCode(), transaction.getId());
        return transaction;
    }

    private LedgerTransactionEntity creditLoyaltyPoints(String playerId, BigDecimal amount, String source, String sourceId,
                                                        Integer expiryDays, String description) {
        requirePositive(amount);
        WalletBalanceEntity balance = lockBalance(playerId);
        BigDecimal before = balance.getLpBalance();
        BigDecimal after = before.add(amount);
        balance.setLpBalance(after);
        balanceRepository.save(balance);

        Integer days = expiryDays != null ? expiryDays : properties.getWallet().getDefaultPointExpiryDays();
        Instant issuedAt = Instant.now();
        pointEntryRepository.save(PointEntryEntity.builder()
                .playerId(playerId)
                .amount(amount)
                .remainingAmount(amount)
                .sourceType(source)
                .sourceId(sourceId)
                .issuedAt(issuedAt)
                .expiresAt(days != null ? issuedAt.plus(days, ChronoUnit.DAYS) : null)
                .expired(false)
                .build());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", source);
        metadata.put("expiry_days", days);
        LedgerTransactionEntity transaction = createTransaction(playerId, TransactionType.LP_EARNED, CurrencyType.LOYALTY_POINTS,
                amount, before, after, description != null ? description : "Loyalty points from " + source, sourceId, metadata);
        log.info("Loyalty points credited: playerId={}, amount={}, source={}, balanceAfter={}", playerId, amount, source, after);

        AfterCommit.run(() -> refreshTier(playerId));
        return transaction;
    }

    private boolean expireBonus(String playerId, Instant now) {
        WalletBalanceEntity balance = balanceRepository.findByPlayerIdForUpdate(playerId).orElse(null);
        if (balance == null || balance.getBonusBalance().signum() <= 0
                || balance.getBonusExpiry() == null || balance.getBonusExpiry().isAfter(now)) {
            return false;
        }
        BigDecimal forfeited = balance.getBonusBalance();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("expired_at", balance.getBonusExpiry().toString());
        metadata.put("wagering_required", balance.getBonusWageringRequired());
        metadata.put("wagering_completed", balance.getBonusWageringCompleted());

        balance.setBonusBalance(BigDecimal.ZERO);
        balance.setBonusWageringRequired(BigDecimal.ZERO);
        balance.setBonusWageringCompleted(BigDecimal.ZERO);
        balance.setBonusExpiry(null);
        balance.setBonusMaxBet(null);
        balance.setBonusEligibleGames(null);
        balanceRepository.save(balance);

        createTransaction(playerId, TransactionType.BONUS_EXPIRED, CurrencyType.BONUS_BALANCE,
                forfeited.negate(), forfeited, BigDecimal.ZERO, "Bonus expired", null, metadata);
        expireBonusRewards(playerId, now);
        log.info("Bonus expired: playerId={}, forfeited={}", playerId, forfeited);
        return true;
    }

    private int expirePointEntries(String playerId, Instant now) {
        WalletBalanceEntity balance = lockBalance(playerId);
        List<PointEntryEntity> due = pointEntryRepository.findDueForExpiry(playerId, now);
        for (PointEntryEntity entry : due) {
            BigDecimal lots = entry.getRemainingAmount();
            BigDecimal before = balance.getLpBalance();
            BigDecimal debit = lots.min(before);
            if (debit.compareTo(lots) < 0) {
                log.error("LP balance below expiring lot: playerId={}, entryId={}, remaining={}, lpBalance={}",
                        playerId, entry.getId(), lots, before);
            }
            BigDecimal after = before.subtract(debit);
            balance.setLpBalance(after);
            balanceRepository.save(balance);
            entry.setRemainingAmount(BigDecimal.ZERO);
            entry.setExpired(true);
            pointEntryRepository.save(entry);
            if (debit.signum() > 0) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("point_entry_id", entry.getId());
                metadata.put("issued_at", entry.getIssuedAt().toString());
                createTransaction(playerId, TransactionType.LP_EXPIRED, CurrencyType.LOYALTY_POINTS,
                        debit.negate(), before, after, "Loyalty points expired", "point-entry:" + entry.getId(), metadata);
            }
        }
        return due.size();
    }

    private void refreshTier(String playerId) {
        try {
            TierLevel tier = tierUpdateHook.updatePlayerTier(playerId);
            log.debug("Tier refreshed after LP credit: playerId={}, tier={}", playerId, tier);
        } catch (RuntimeException e) {
            log.error("Tier update failed after LP credit: playerId={}", playerId, e);
        }
    }

    private void completeBonusRewards(String playerId) {
        Instant now = Instant.now();
        for (RewardRecordEntity reward : rewardRepository.findByPlayerIdAndStatusAndCurrencyType(
                playerId, RewardStatus.ACTIVE, CurrencyType.BONUS_BALANCE)) {
            if (reward.getWageringRequired().signum() <= 0) {
                continue;
            }
            reward.setWageringCompleted(reward.getWageringRequired());
            reward.setStatus(RewardStatus.COMPLETED);
            reward.setCompletedAt(now);
            rewardRepository.save(reward);
            publishStatusChange(reward);
        }
    }

    private void expireBonusRewards(String playerId, Instant now) {
        for (RewardRecordEntity reward : rewardRepository.findByPlayerIdAndStatusAndCurrencyType(
                playerId, RewardStatus.ACTIVE, CurrencyType.BONUS_BALANCE)) {
            if (reward.getExpiresAt() == null || reward.getExpiresAt().isAfter(now)) {
                continue;
            }
            reward.setStatus(RewardStatus.EXPIRED);
            reward.setCompletedAt(now);
            rewardRepository.save(reward);
            publishStatusChange(reward);
        }
    }

    private void publishStatusChange(RewardRecordEntity reward) {
        LedgerEvent event = LedgerEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(LedgerEvent.REWARD_STATUS_CHANGED)
                .playerId(reward.getPlayerId())
                .rewardId(reward.getId())
                .ruleId(reward.getRuleId())
                .rewardStatus(reward.getStatus())
                .amount(reward.getAmount())
                .currencyType(reward.getCurrencyType())
                .timestamp(Instant.now())
                .build();
        AfterCommit.run(() -> eventPublisher.publish(event));
    }

    private void verifyPointReconciliation(String playerId) {
        BigDecimal lots = Amounts.orZero(pointEntryRepository.sumRemainingByPlayer(playerId));
        BigDecimal lpBalance = balanceRepository.findByPlayerId(playerId)
                .map(WalletBalanceEntity::getLpBalance)
                .orElse(BigDecimal.ZERO);
        if (lots.compareTo(lpBalance) != 0) {
            log.error("LP balance does not match point lots: playerId={}, lpBalance={}, lots={}", playerId, lpBalance, lots);
        }
    }

    private TierLevel currentTier(String playerId) {
        return playerStateProvider.getPlayerState(playerId).getString("tier")
                .map(TierLevel::valueOf)
                .orElse(TierLevel.BRONZE);
    }

    // Row lock held until the surrounding transaction ends. FOR UPDATE cannot lock a row that does not
    // exist yet, so a missing wallet is committed first and then locked like any other.
    private WalletBalanceEntity lockBalance(String playerId) {
        Optional<WalletBalanceEntity> locked = balanceRepository.findByPlayerIdForUpdate(playerId);
        if (locked.isPresent()) {
            return locked.get();
        }
        ensureBalanceExists(playerId);
        return balanceRepository.findByPlayerIdForUpdate(playerId)
                .orElseThrow(() -> new IllegalStateException("Wallet missing after create: playerId=" + playerId));
    }

    private void ensureBalanceExists(String playerId) {
        try {
            requiresNewTransactionTemplate.execute(status -> balanceRepository.saveAndFlush(WalletBalanceEntity.builder()
                    .playerId(playerId)
                    .build()));
            log.info("Created wallet: playerId={}", playerId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Wallet created concurrently: playerId={}", playerId);
        }
    }

    private static TransactionType debitType(CurrencyType currency) {
        return switch (currency) {
            case LOYALTY_POINTS -> TransactionType.LP_REDEEMED;
            case REWARD_POINTS -> TransactionType.RP_REDEEMED;
            case BONUS_BALANCE -> TransactionType.BONUS_DEBITED;
            case TICKETS -> TransactionType.TICKETS_REDEEMED;
            case CASH -> throw new IllegalArgumentException("CASH has no wallet balance");
        };
    }

    private static void requireWalletCurrency(CurrencyType currency) {
        if (currency == null || !currency.hasWalletBalance()) {
            throw new IllegalArgumentException("Not a wallet currency: " + currency);
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (!Amounts.isPositive(amount)) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }
}
