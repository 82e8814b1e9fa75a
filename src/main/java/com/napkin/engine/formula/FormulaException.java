package com.napkin.engine.formula;

/**
 * Thrown when a formula cannot be evaluated.
 * The {@link FormulaErrorType} tells callers (and tests) which stage failed.
 */
public class FormulaException extends RuntimeException {
    private final FormulaErrorType type;

    public FormulaException(FormulaErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public FormulaErrorType getType() {
        return type;
    }
}
