package com.napkin.engine.grid;

/**
 * One pending change of a cell's input, used for batch edits such as a paste.
 */
public class CellEdit {
    private final int row;
    private final int column;
    private final String input;

    public CellEdit(int row, int column, String input) {
        this.row = row;
        this.column = column;
        this.input = input;
    }

    public int getRow() {
        return row;
    }
    public int getColumn() {
        return column;
    }
    public String getInput() {
        return input;
    }
}
