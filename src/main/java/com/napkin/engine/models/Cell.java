package com.napkin.engine.models;

/**
 * Represents a single grid cell.
 * Stores:
 * - its fixed position (row, column), zero-based
 * - input (empty, a plain literal, or a formula starting with '=')
 * - displayValue (what the user sees after the last evaluation)
 * - hasError, set when the formula failed or sits on a reference cycle
 */
public class Cell {
    public static final char FORMULA_MARKER = '=';
    public static final String ERROR_VALUE = "#ERROR";

    private final int row;
    private final int column;
    private String input = "";
    private String displayValue = "";
    private boolean hasError;

    public Cell(int row, int column) {
        this.row = row;
        this.column = column;
    }

    // Basic getters
    public int getRow() {
        return row;
    }
    public int getColumn() {
        return column;
    }
    public CellCoordinate getCoordinate() {
        return new CellCoordinate(row, column);
    }
    public String getInput() {
        return input;
    }
    public String getDisplayValue() {
        return displayValue;
    }
    public boolean hasError() {
        return hasError;
    }

    public void setInput(String input) {
        this.input = input == null ? "" : input;
    }

    public boolean isEmpty() {
        return input.isEmpty();
    }

    public boolean isFormula() {
        return !input.isEmpty() && input.charAt(0) == FORMULA_MARKER;
    }

    /**
     * The formula text without its leading marker; only meaningful when {@link #isFormula()}.
     */
    public String getFormulaBody() {
        return input.substring(1);
    }

    /**
     * Stores a successfully computed (or copied) value and clears the error flag.
     */
    public void setValue(String displayValue) {
        this.displayValue = displayValue;
        this.hasError = false;
    }

    /**
     * Replaces whatever was displayed with the error sentinel.
     */
    public void markError() {
        this.displayValue = ERROR_VALUE;
        this.hasError = true;
    }

    public void clear() {
        input = "";
        displayValue = "";
        hasError = false;
    }
}
