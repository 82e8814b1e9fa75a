package com.napkin.engine.formula;

/**
 * Reasons a formula can fail. Every one of them is terminal for the cell
 * being evaluated; the grid shows {@code #ERROR} regardless of which.
 */
public enum FormulaErrorType {
    INVALID_FORMULA,
    INVALID_REFERENCE,
    DIVISION_BY_ZERO,
    INVALID_FUNCTION,
    INVALID_RANGE,
    // only raised by the grid, the evaluator cannot see the whole graph
    CIRCULAR_REFERENCE
}
