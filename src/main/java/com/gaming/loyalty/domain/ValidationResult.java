package com.gaming.loyalty.domain;

import lombok.Value;

/**
 * Outcome of a safety-gate check. Rejections carry a human-readable reason.
 */
@Value
public class ValidationResult {

    boolean approved;
    String reason;

    public static ValidationResult approve(String reason) {
        return new ValidationResult(true, reason);
    }

    public static ValidationResult reject(String reason) {
        return new ValidationResult(false, reason);
    }
}
