package com.gaming.loyalty.exception;

/**
 * Thrown when a redemption requires a higher loyalty tier than the player holds.
 */
public class TierRequirementNotMetException extends RuntimeException {

    public TierRequirementNotMetException(String message) {
        super(message);
    }

    public TierRequirementNotMetException(String message, Throwable cause) {
        super(message, cause);
    }
}
