package com.gaming.loyalty.exception;

import com.gaming.loyalty.domain.CurrencyType;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Thrown when a debit exceeds the available balance. Nothing is debited in that case.
 */
@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final String playerId;
    private final CurrencyType currency;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientBalanceException(String playerId, CurrencyType currency, BigDecimal requested, BigDecimal available) {
        super("Insufficient " + currency.getCode() + " balance for player " + playerId
                + ": requested=" + requested.toPlainString() + ", available=" + available.toPlainString());
        this.playerId = playerId;
        this.currency = currency;
        this.requested = requested;
        this.available = available;
    }
}
