package com.gaming.loyalty.exception;

/**
 * Thrown when a rule or redemption rule cannot be used as configured (unknown reward type, inactive rule).
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
