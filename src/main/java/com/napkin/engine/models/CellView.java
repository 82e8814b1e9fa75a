package com.napkin.engine.models;

/**
 * Read-only snapshot of a cell as returned by the REST layer.
 */
public class CellView {
    private final String label;
    private final String input;
    private final String value;
    private final boolean error;

    public CellView(String label, String input, String value, boolean error) {
        this.label = label;
        this.input = input;
        this.value = value;
        this.error = error;
    }

    public String getLabel() {
        return label;
    }
    public String getInput() {
        return input;
    }
    public String getValue() {
        return value;
    }
    public boolean isError() {
        return error;
    }
}
