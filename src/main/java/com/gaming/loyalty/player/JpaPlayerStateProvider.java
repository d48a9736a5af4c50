package com.gaming.loyalty.player;

import com.gaming.loyalty.domain.Amounts;
import com.gaming.loyalty.domain.TransactionType;
import com.gaming.loyalty.exception.NotFoundException;
import com.gaming.loyalty.persistence.entity.AbuseSignalEntity;
import com.gaming.loyalty.persistence.entity.PlayerEntity;
import com.gaming.loyalty.persistence.entity.WalletBalanceEntity;
import com.gaming.loyalty.persistence.repository.AbuseSignalRepository;
import com.gaming.loyalty.persistence.repository.LedgerTransactionRepository;
import com.gaming.loyalty.persistence.repository.PlayerRepository;
import com.gaming.loyalty.persistence.repository.WalletBalanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds player state from the player profile row, the activity journal and the wallet.
 * Financial totals are derived from DEPOSIT / WITHDRAWAL / WAGER / WIN ledger rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaPlayerStateProvider implements PlayerStateProvider {

    private final PlayerRepository playerRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final WalletBalanceRepository balanceRepository;
    private final AbuseSignalRepository abuseSignalRepository;

    @Override
    public PlayerState getPlayerState(String playerId) {
        PlayerEntity player = playerRepository.findById(playerId)
                .orElseThrow(() -> new NotFoundException("Player not found: " + playerId));

        BigDecimal deposited = total(playerId, TransactionType.DEPOSIT);
        BigDecimal withdrawn = total(playerId, TransactionType.WITHDRAWAL);
        BigDecimal wagered = total(playerId, TransactionType.WAGER);
        BigDecimal won = total(playerId, TransactionType.WIN);
        long bets = transactionRepository.countByPlayerAndType(playerId, TransactionType.WAGER);

        // Positive when the player is ahead of the house
        BigDecimal netPnl = won.subtract(deposited).add(withdrawn);

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("player_id", player.getPlayerId());
        state.put("segment", player.getSegment() != null ? player.getSegment().name() : null);
        state.put("tier", player.getTier().name());
        state.put("risk_score", player.getRiskScore());
        state.put("is_active", player.isActive());
        state.put("is_blocked", player.isBlocked());
        state.put("kyc_completed", player.isKycCompleted());
        state.put("session_count", player.getSessionCount());
        state.put("total_deposited", deposited);
        state.put("total_withdrawn", withdrawn);
        state.put("total_wagered", wagered);
        state.put("total_won", won);
        state.put("net_pnl", netPnl);
        state.put("net_loss", netPnl.signum() < 0 ? netPnl.negate() : BigDecimal.ZERO);
        state.put("total_bets", bets);
        state.put("avg_bet_size", bets > 0
                ? wagered.divide(BigDecimal.valueOf(bets), Amounts.SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO);

        Instant lastDeposit = transactionRepository.findLatestCreatedAt(playerId, TransactionType.DEPOSIT);
        if (lastDeposit != null) {
            state.put("days_since_last_deposit", Duration.between(lastDeposit, Instant.now()).toDays());
        }

        state.put("bonus_abuse_score", abuseSignalRepository.findByPlayerIdAndResolvedFalse(playerId).stream()
                .mapToInt(AbuseSignalEntity::getSeverity)
                .sum());

        WalletBalanceEntity wallet = balanceRepository.findByPlayerId(playerId).orElse(null);
        state.put("lp_balance", wallet != null ? wallet.getLpBalance() : BigDecimal.ZERO);
        state.put("rp_balance", wallet != null ? wallet.getRpBalance() : BigDecimal.ZERO);
        state.put("bonus_balance", wallet != null ? wallet.getBonusBalance() : BigDecimal.ZERO);
        state.put("tickets_balance", wallet != null ? wallet.getTicketsBalance() : BigDecimal.ZERO);

        log.debug("Loaded player state: playerId={}, fields={}", playerId, state.size());
        return PlayerState.of(state);
    }

    // Withdrawals and wagers are journaled as negative amounts
    private BigDecimal total(String playerId, TransactionType type) {
        return Amounts.orZero(transactionRepository.sumAmountByPlayerAndType(playerId, type)).abs();
    }
}
