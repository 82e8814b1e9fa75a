package com.napkin.engine.grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a grid's display values as CSV, trimmed to the bounding box of
 * cells that have input.
 */
public final class GridCsvWriter {

    private GridCsvWriter() {
    }

    public static String write(Grid grid) {
        grid.getLock().readLock().lock();
        try {
            int maxRow = -1;
            int maxColumn = -1;
            for (int r = 0; r < grid.getRows(); r++) {
                for (int c = 0; c < grid.getColumns(); c++) {
                    if (!grid.getCell(r, c).isEmpty()) {
                        maxRow = Math.max(maxRow, r);
                        maxColumn = Math.max(maxColumn, c);
                    }
                }
            }
            if (maxRow < 0) {
                return "";
            }

            List<String> lines = new ArrayList<>();
            for (int r = 0; r <= maxRow; r++) {
                List<String> fields = new ArrayList<>();
                for (int c = 0; c <= maxColumn; c++) {
                    fields.add(quote(grid.getCell(r, c).getDisplayValue()));
                }
                lines.add(String.join(",", fields));
            }
            return String.join("\n", lines);
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    private static String quote(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
