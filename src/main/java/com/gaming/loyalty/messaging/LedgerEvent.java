package com.gaming.loyalty.messaging;

import com.gaming.loyalty.domain.CurrencyType;
import com.gaming.loyalty.domain.RewardStatus;
import com.gaming.loyalty.domain.TransactionType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event emitted to Kafka for every committed ledger row and every reward status change.
 * Consumers use it for reporting, CRM triggers and reconciliation against the ledger tables.
 */
@Value
@Builder
@Jacksonized
public class LedgerEvent {

    public static final String TRANSACTION_RECORDED = "TRANSACTION_RECORDED";
    public static final String REWARD_STATUS_CHANGED = "REWARD_STATUS_CHANGED";

    String eventId;
    String eventType;
    String playerId;
    Long transactionId;
    TransactionType transactionType;
    CurrencyType currencyType;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    String referenceId;
    Long rewardId;
    String ruleId;
    RewardStatus rewardStatus;
    Instant timestamp;
}
