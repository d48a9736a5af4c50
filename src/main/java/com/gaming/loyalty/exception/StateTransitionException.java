package com.gaming.loyalty.exception;

/**
 * Thrown when a reward is asked to move to a status its current status does not allow (e.g. issuing twice).
 */
public class StateTransitionException extends RuntimeException {

    public StateTransitionException(String message) {
        super(message);
    }

    public StateTransitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
