package com.gaming.loyalty.player;

import com.gaming.loyalty.domain.AbuseSignalType;
import com.gaming.loyalty.domain.CurrencyType;
import com.gaming.loyalty.domain.PlayerSegment;
import com.gaming.loyalty.domain.TransactionType;
import com.gaming.loyalty.exception.NotFoundException;
import com.gaming.loyalty.persistence.entity.AbuseSignalEntity;
import com.gaming.loyalty.persistence.entity.LedgerTransactionEntity;
import com.gaming.loyalty.persistence.entity.PlayerEntity;
import com.gaming.loyalty.persistence.entity.WalletBalanceEntity;
import com.gaming.loyalty.persistence.repository.AbuseSignalRepository;
import com.gaming.loyalty.persistence.repository.LedgerTransactionRepository;
import com.gaming.loyalty.persistence.repository.PlayerRepository;
import com.gaming.loyalty.persistence.repository.WalletBalanceRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaPlayerStateProvider.class)
class JpaPlayerStateProviderTest {

    @Autowired private JpaPlayerStateProvider provider;
    @Autowired private PlayerRepository playerRepository;
    @Autowired private LedgerTransactionRepository transactionRepository;
    @Autowired private WalletBalanceRepository balanceRepository;
    @Autowired private AbuseSignalRepository abuseSignalRepository;

    private void journal(String playerId, TransactionType type, String amount, Instant at) {
        transactionRepository.save(LedgerTransactionEntity.builder()
                .playerId(playerId)
                .transactionType(type)
                .currencyType(CurrencyType.CASH)
                .amount(new BigDecimal(amount))
                .balanceBefore(BigDecimal.ZERO)
                .balanceAfter(BigDecimal.ZERO)
                .createdAt(at)
                .build());
    }

    @Test
    void derivesTotalsFromJournalAndWallet() {
        playerRepository.save(PlayerEntity.builder().playerId("p1").segment(PlayerSegment.LOSING).sessionCount(12).build());
        Instant threeDaysAgo = Instant.now().minus(3, ChronoUnit.DAYS);
        journal("p1", TransactionType.DEPOSIT, "1000", threeDaysAgo);
        journal("p1", TransactionType.WAGER, "-300", Instant.now());
        journal("p1", TransactionType.WAGER, "-100", Instant.now());
        journal("p1", TransactionType.WIN, "150", Instant.now());
        journal("p1", TransactionType.WITHDRAWAL, "-50", Instant.now());
        balanceRepository.save(WalletBalanceEntity.builder().playerId("p1").lpBalance(new BigDecimal("420")).build());
        abuseSignalRepository.save(AbuseSignalEntity.builder()
                .playerId("p1")
                .signalType(AbuseSignalType.BONUS_ONLY_PLAY)
                .severity(AbuseSignalType.BONUS_ONLY_PLAY.getSeverity())
                .description("test")
                .build());

        PlayerState state = provider.getPlayerState("p1");

        assertThat(state.getString("segment")).contains("LOSING");
        assertThat(state.getString("tier")).contains("BRONZE");
        assertThat(state.getNumber("total_deposited")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("1000"));
        assertThat(state.getNumber("total_wagered")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("400"));
        assertThat(state.getNumber("total_withdrawn")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("50"));
        assertThat(state.getNumber("net_pnl")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("-800"));
        assertThat(state.getNumber("net_loss")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("800"));
        assertThat(state.getNumber("total_bets")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("2"));
        assertThat(state.getNumber("avg_bet_size")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("200"));
        assertThat(state.getNumber("days_since_last_deposit")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("3"));
        assertThat(state.getNumber("bonus_abuse_score")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("5"));
        assertThat(state.getNumber("lp_balance")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("420"));
        assertThat(state.getNumber("session_count")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("12"));
    }

    @Test
    void playerWithoutActivityHasZeroTotalsAndNoDepositAge() {
        playerRepository.save(PlayerEntity.builder().playerId("fresh").build());

        PlayerState state = provider.getPlayerState("fresh");

        assertThat(state.getNumber("net_loss")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("0"));
        assertThat(state.has("days_since_last_deposit")).isFalse();
        assertThat(state.has("segment")).isFalse();
        assertThat(state.getNumber("bonus_balance")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("0"));
    }

    @Test
    void unknownPlayerIsNotFound() {
        assertThatThrownBy(() -> provider.getPlayerState("ghost")).isInstanceOf(NotFoundException.class);
    }
}
