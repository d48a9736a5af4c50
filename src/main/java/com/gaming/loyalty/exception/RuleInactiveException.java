package com.gaming.loyalty.exception;

/**
 * Thrown when a deactivated redemption rule is used.
 */
public class RuleInactiveException extends ConfigurationException {

    public RuleInactiveException(String message) {
        super(message);
    }

    public RuleInactiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
