package com.napkin.engine.models;

/**
 * Optional body of POST /grid. Missing values fall back to the configured defaults.
 */
public class GridDimensions {
    private Integer rows;
    private Integer columns;

    // Default constructor needed for JSON (de)serialization
    public GridDimensions() {
    }

    public GridDimensions(Integer rows, Integer columns) {
        this.rows = rows;
        this.columns = columns;
    }

    public Integer getRows() {
        return rows;
    }
    public Integer getColumns() {
        return columns;
    }
    public void setRows(Integer rows) {
        this.rows = rows;
    }
    public void setColumns(Integer columns) {
        this.columns = columns;
    }
}
