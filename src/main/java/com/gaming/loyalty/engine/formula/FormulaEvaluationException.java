package com.gaming.loyalty.engine.formula;

/**
 * Thrown when a reward formula cannot be tokenized, parsed or evaluated.
 */
public class FormulaEvaluationException extends RuntimeException {

    public FormulaEvaluationException(String message) {
        super(message);
    }

    public FormulaEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
