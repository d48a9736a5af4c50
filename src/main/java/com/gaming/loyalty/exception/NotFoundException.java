package com.gaming.loyalty.exception;

/**
 * Thrown when a player, reward, rule or signal referenced by id does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
