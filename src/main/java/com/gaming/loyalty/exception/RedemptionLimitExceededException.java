package com.gaming.loyalty.exception;

/**
 * Thrown when a player has used up a redemption rule's monthly allowance.
 */
public class RedemptionLimitExceededException extends RuntimeException {

    public RedemptionLimitExceededException(String message) {
        super(message);
    }

    public RedemptionLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
