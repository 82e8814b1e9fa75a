package com.napkin.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Grid sizing, bound from "napkin.grid.*" in application.properties.
 */
@ConfigurationProperties(prefix = "napkin.grid")
public class GridProperties {
    // 20 x 10 matches the napkin's default sheet
    private int defaultRows = 20;
    private int defaultColumns = 10;
    private int maxRows = 1000;
    private int maxColumns = 100;

    public int getDefaultRows() {
        return defaultRows;
    }
    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }
    public int getDefaultColumns() {
        return defaultColumns;
    }
    public void setDefaultColumns(int defaultColumns) {
        this.defaultColumns = defaultColumns;
    }
    public int getMaxRows() {
        return maxRows;
    }
    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }
    public int getMaxColumns() {
        return maxColumns;
    }
    public void setMaxColumns(int maxColumns) {
        this.maxColumns = maxColumns;
    }
}
