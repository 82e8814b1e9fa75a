package com.napkin.engine.services;

import com.napkin.engine.config.GridProperties;
import com.napkin.engine.exceptions.GridNotFoundException;
import com.napkin.engine.exceptions.InvalidGridDimensionsException;
import com.napkin.engine.formula.CellReferences;
import com.napkin.engine.grid.CellEdit;
import com.napkin.engine.grid.Grid;
import com.napkin.engine.grid.GridCsvWriter;
import com.napkin.engine.grid.RecalculationResult;
import com.napkin.engine.models.Cell;
import com.napkin.engine.models.CellCoordinate;
import com.napkin.engine.models.CellView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for creating grids, applying edits and reading
 * back evaluated values. Every edit ends in a full recompute of its grid.
 */
@Service
public class GridService {

    private static final Logger logger = LoggerFactory.getLogger(GridService.class);

    // All grids live here in memory; persistence is the caller's concern
    private final Map<Long, Grid> grids = new ConcurrentHashMap<>();

    private final GridProperties properties;

    public GridService(GridProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates a new grid and returns its ID. Null dimensions use the configured defaults.
     */
    public long createGrid(Integer rows, Integer columns) {
        int r = rows == null ? properties.getDefaultRows() : rows;
        int c = columns == null ? properties.getDefaultColumns() : columns;
        if (r > properties.getMaxRows() || c > properties.getMaxColumns()) {
            throw new InvalidGridDimensionsException("Grid " + r + "x" + c + " exceeds the limit of "
                    + properties.getMaxRows() + "x" + properties.getMaxColumns());
        }
        Grid grid = new Grid(r, c);
        grids.put(grid.getId(), grid);
        logger.info("Created grid {} ({}x{})", grid.getId(), r, c);
        return grid.getId();
    }

    /**
     * Retrieves a Grid by ID. Throws if not found.
     */
    public Grid getGrid(long gridId) {
        Grid grid = grids.get(gridId);
        if (grid == null) {
            throw new GridNotFoundException("Grid not found: " + gridId);
        }
        return grid;
    }

    /**
     * Sets one cell's input (literal or "=formula") and returns the cell after recompute.
     */
    public CellView setCell(long gridId, String label, String input) {
        Grid grid = getGrid(gridId);
        CellCoordinate coordinate = CellReferences.decode(label);
        RecalculationResult result = grid.applyEdit(coordinate.getRow(), coordinate.getColumn(), input);
        logger.debug("Grid {}: set {} to '{}', {} formula cell(s) recomputed",
                gridId, label, input, result.getFormulaCount());
        return getCell(gridId, label);
    }

    /**
     * Applies a batch of label -> input edits with a single recompute.
     */
    public Map<String, CellView> setCells(long gridId, Map<String, String> inputs) {
        Grid grid = getGrid(gridId);
        List<CellEdit> edits = new ArrayList<>();
        for (Map.Entry<String, String> entry : inputs.entrySet()) {
            CellCoordinate coordinate = CellReferences.decode(entry.getKey());
            edits.add(new CellEdit(coordinate.getRow(), coordinate.getColumn(), entry.getValue()));
        }
        grid.applyEdits(edits);
        logger.debug("Grid {}: applied {} edit(s)", gridId, edits.size());

        Map<String, CellView> updated = new LinkedHashMap<>();
        for (String label : inputs.keySet()) {
            updated.put(label, getCell(gridId, label));
        }
        return updated;
    }

    public CellView getCell(long gridId, String label) {
        Grid grid = getGrid(gridId);
        grid.getLock().readLock().lock();
        try {
            return toView(grid.getCell(label));
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    /**
     * Returns label -> cell snapshot for every cell that has input, row by row.
     */
    public Map<String, CellView> getGridData(long gridId) {
        Grid grid = getGrid(gridId);
        grid.getLock().readLock().lock();
        try {
            Map<String, CellView> data = new LinkedHashMap<>();
            for (int r = 0; r < grid.getRows(); r++) {
                for (int c = 0; c < grid.getColumns(); c++) {
                    Cell cell = grid.getCell(r, c);
                    if (!cell.isEmpty()) {
                        CellView view = toView(cell);
                        data.put(view.getLabel(), view);
                    }
                }
            }
            return data;
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    /**
     * Forward dependency graph by label: formula cell -> cells it references.
     */
    public Map<String, List<String>> getDependencies(long gridId) {
        Map<CellCoordinate, Set<CellCoordinate>> graph = getGrid(gridId).dependencyGraph();
        Map<String, List<String>> labelled = new LinkedHashMap<>();
        for (Map.Entry<CellCoordinate, Set<CellCoordinate>> entry : graph.entrySet()) {
            List<String> references = new ArrayList<>();
            for (CellCoordinate ref : entry.getValue()) {
                references.add(CellReferences.encode(ref));
            }
            labelled.put(CellReferences.encode(entry.getKey()), references);
        }
        return labelled;
    }

    public String exportCsv(long gridId) {
        return GridCsvWriter.write(getGrid(gridId));
    }

    public void clearGrid(long gridId) {
        getGrid(gridId).clear();
        logger.info("Cleared grid {}", gridId);
    }

    private CellView toView(Cell cell) {
        return new CellView(CellReferences.encode(cell.getCoordinate()), cell.getInput(),
                cell.getDisplayValue(), cell.hasError());
    }
}
